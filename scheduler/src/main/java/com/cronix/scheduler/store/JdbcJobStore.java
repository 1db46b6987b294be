package com.cronix.scheduler.store;

import static com.cronix.scheduler.store.JdbcSupport.getInstant;
import static com.cronix.scheduler.store.JdbcSupport.getInteger;
import static com.cronix.scheduler.store.JdbcSupport.setInstant;
import static com.cronix.scheduler.store.JdbcSupport.setInteger;
import static com.cronix.scheduler.store.JdbcSupport.uuid;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import javax.sql.DataSource;

import com.cronix.scheduler.domain.Job;
import com.cronix.scheduler.exception.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL job store. Headers are kept as a JSONB object.
 */
public class JdbcJobStore implements JobStore {
    private static final String COLUMNS = "id, user_id, name, schedule, endpoint, method, headers, body, active, "
            + "timeout_seconds, max_retries, next_fire_at, created_at, updated_at";
    private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<>() {
    };

    private final DataSource ds;
    private final ObjectMapper mapper;

    public JdbcJobStore(DataSource ds, ObjectMapper mapper) {
        this.ds = ds;
        this.mapper = mapper;
    }

    @Override
    public Job insert(Job job) {
        String sql = "INSERT INTO jobs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, UUID.fromString(job.getId()));
            ps.setObject(2, UUID.fromString(job.getOwnerId()));
            ps.setString(3, job.getName());
            ps.setString(4, job.getSchedule());
            ps.setString(5, job.getEndpoint());
            ps.setString(6, job.getMethod());
            ps.setString(7, writeHeaders(job.getHeaders()));
            ps.setString(8, job.getBody());
            ps.setBoolean(9, job.isActive());
            setInteger(ps, 10, job.getTimeoutSeconds());
            setInteger(ps, 11, job.getMaxRetries());
            setInstant(ps, 12, job.getNextFireAt());
            setInstant(ps, 13, job.getCreatedAt());
            setInstant(ps, 14, job.getUpdatedAt());
            ps.executeUpdate();
            return job;
        } catch (SQLException e) {
            throw new StoreException("insert job " + job.getId() + " failed", e);
        }
    }

    @Override
    public Optional<Job> findById(String id) {
        UUID key = uuid(id);
        if (key == null) {
            return Optional.empty();
        }
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE id = ?")) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("load job " + id + " failed", e);
        }
    }

    @Override
    public List<Job> listByOwner(String ownerId, int limit, int offset) {
        UUID owner = uuid(ownerId);
        if (owner == null) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE user_id = ? ORDER BY created_at DESC, id LIMIT ? OFFSET ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, owner);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            return mapAll(ps);
        } catch (SQLException e) {
            throw new StoreException("list jobs of " + ownerId + " failed", e);
        }
    }

    @Override
    public List<Job> listActive() {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE active")) {
            return mapAll(ps);
        } catch (SQLException e) {
            throw new StoreException("list active jobs failed", e);
        }
    }

    @Override
    public Optional<Job> update(Job job) {
        String sql = "UPDATE jobs SET name = ?, schedule = ?, endpoint = ?, method = ?, headers = ?::jsonb, body = ?, "
                + "active = ?, timeout_seconds = ?, max_retries = ?, updated_at = ? WHERE id = ? RETURNING next_fire_at";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, job.getName());
            ps.setString(2, job.getSchedule());
            ps.setString(3, job.getEndpoint());
            ps.setString(4, job.getMethod());
            ps.setString(5, writeHeaders(job.getHeaders()));
            ps.setString(6, job.getBody());
            ps.setBoolean(7, job.isActive());
            setInteger(ps, 8, job.getTimeoutSeconds());
            setInteger(ps, 9, job.getMaxRetries());
            setInstant(ps, 10, job.getUpdatedAt());
            ps.setObject(11, UUID.fromString(job.getId()));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(job.toBuilder().nextFireAt(getInstant(rs, "next_fire_at")).build());
            }
        } catch (SQLException e) {
            throw new StoreException("update job " + job.getId() + " failed", e);
        }
    }

    @Override
    public boolean delete(String id) {
        UUID key = uuid(id);
        if (key == null) {
            return false;
        }
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            ps.setObject(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("delete job " + id + " failed", e);
        }
    }

    @Override
    public void updateNextFire(String id, Instant nextFireAt) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE jobs SET next_fire_at = ? WHERE id = ?")) {
            setInstant(ps, 1, nextFireAt);
            ps.setObject(2, UUID.fromString(id));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("update next fire of job " + id + " failed", e);
        }
    }

    @Override
    public boolean ping() {
        try (Connection c = ds.getConnection()) {
            return c.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }

    private List<Job> mapAll(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    private Job map(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getObject("id").toString())
                .ownerId(rs.getObject("user_id").toString())
                .name(rs.getString("name"))
                .schedule(rs.getString("schedule"))
                .endpoint(rs.getString("endpoint"))
                .method(rs.getString("method"))
                .headers(readHeaders(rs.getString("headers")))
                .body(rs.getString("body"))
                .active(rs.getBoolean("active"))
                .timeoutSeconds(getInteger(rs, "timeout_seconds"))
                .maxRetries(getInteger(rs, "max_retries"))
                .nextFireAt(getInstant(rs, "next_fire_at"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private String writeHeaders(Map<String, String> headers) {
        try {
            return mapper.writeValueAsString(headers == null ? Map.of() : headers);
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot encode headers", e);
        }
    }

    private Map<String, String> readHeaders(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Map.copyOf(mapper.readValue(json, HEADERS));
        } catch (JsonProcessingException e) {
            throw new StoreException("cannot decode headers", e);
        }
    }
}
