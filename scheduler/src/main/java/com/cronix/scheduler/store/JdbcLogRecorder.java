package com.cronix.scheduler.store;

import static com.cronix.scheduler.store.JdbcSupport.getInstant;
import static com.cronix.scheduler.store.JdbcSupport.getInteger;
import static com.cronix.scheduler.store.JdbcSupport.getLong;
import static com.cronix.scheduler.store.JdbcSupport.setInstant;
import static com.cronix.scheduler.store.JdbcSupport.setInteger;
import static com.cronix.scheduler.store.JdbcSupport.uuid;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import javax.sql.DataSource;

import com.cronix.scheduler.domain.JobLog;
import com.cronix.scheduler.domain.JobLogStatus;
import com.cronix.scheduler.exception.StoreException;

public class JdbcLogRecorder implements LogRecorder {
    private static final String COLUMNS = "id, job_id, started_at, finished_at, duration_ms, status, response_code, "
            + "error, response_body, attempts";

    private static final String TRIM_JOB = "DELETE FROM job_logs WHERE job_id = ? AND finished_at IS NOT NULL "
            + "AND id NOT IN (SELECT id FROM job_logs WHERE job_id = ? AND finished_at IS NOT NULL "
            + "ORDER BY started_at DESC, id DESC LIMIT ?)";

    private static final String TRIM_ALL = "DELETE FROM job_logs WHERE id IN (SELECT id FROM ("
            + "SELECT id, ROW_NUMBER() OVER (PARTITION BY job_id ORDER BY started_at DESC, id DESC) AS rn "
            + "FROM job_logs WHERE finished_at IS NOT NULL) ranked WHERE rn > ?)";

    private final DataSource ds;

    public JdbcLogRecorder(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public JobLog begin(String jobId, Instant startedAt) {
        JobLog log = JobLog.builder()
                .id(UUID.randomUUID().toString())
                .jobId(jobId)
                .startedAt(startedAt)
                .status(JobLogStatus.RUNNING)
                .build();
        insert(log);
        return log;
    }

    @Override
    public void complete(JobLog log) {
        String sql = "UPDATE job_logs SET finished_at = ?, duration_ms = ?, status = ?, response_code = ?, error = ?, "
                + "response_body = ?, attempts = ? WHERE id = ? AND finished_at IS NULL";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            setInstant(ps, 1, log.getFinishedAt());
            setLong(ps, 2, log.getDurationMs());
            ps.setString(3, log.getStatus().wireName());
            setInteger(ps, 4, log.getResponseCode());
            ps.setString(5, log.getError());
            ps.setString(6, log.getResponseBody());
            ps.setInt(7, log.getAttempts());
            ps.setObject(8, UUID.fromString(log.getId()));
            // zero rows: the job and its history were deleted while the run was in flight
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("complete log " + log.getId() + " failed", e);
        }
    }

    @Override
    public JobLog append(JobLog log) {
        JobLog stored = log.getId() == null ? log.toBuilder().id(UUID.randomUUID().toString()).build() : log;
        insert(stored);
        return stored;
    }

    @Override
    public List<JobLog> list(String jobId, int limit, int offset) {
        UUID key = uuid(jobId);
        if (key == null) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM job_logs WHERE job_id = ? AND finished_at IS NOT NULL "
                + "ORDER BY started_at DESC, id DESC LIMIT ? OFFSET ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, key);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            List<JobLog> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("list logs of job " + jobId + " failed", e);
        }
    }

    @Override
    public int cleanup(RetentionPolicy policy, Instant now) {
        int deleted = 0;
        try (Connection c = ds.getConnection()) {
            if (policy.hasAgeLimit()) {
                try (PreparedStatement ps = c.prepareStatement(
                        "DELETE FROM job_logs WHERE finished_at IS NOT NULL AND started_at < ?")) {
                    setInstant(ps, 1, now.minus(policy.getMaxAge()));
                    deleted += ps.executeUpdate();
                }
            }
            if (policy.hasPerJobLimit()) {
                try (PreparedStatement ps = c.prepareStatement(TRIM_ALL)) {
                    ps.setInt(1, policy.getMaxPerJob());
                    deleted += ps.executeUpdate();
                }
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("log cleanup failed", e);
        }
    }

    @Override
    public int cleanupJob(String jobId, int keep) {
        UUID key = uuid(jobId);
        if (key == null) {
            return 0;
        }
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(TRIM_JOB)) {
            ps.setObject(1, key);
            ps.setObject(2, key);
            ps.setInt(3, Math.max(keep, 0));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("log cleanup of job " + jobId + " failed", e);
        }
    }

    @Override
    public int deleteByJob(String jobId) {
        UUID key = uuid(jobId);
        if (key == null) {
            return 0;
        }
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM job_logs WHERE job_id = ?")) {
            ps.setObject(1, key);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("delete logs of job " + jobId + " failed", e);
        }
    }

    @Override
    public int failUnfinished(String error, Instant finishedAt) {
        String sql = "UPDATE job_logs SET status = ?, error = ?, finished_at = GREATEST(?, started_at), "
                + "duration_ms = (EXTRACT(EPOCH FROM (GREATEST(?, started_at) - started_at)) * 1000)::BIGINT "
                + "WHERE finished_at IS NULL";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobLogStatus.FAILURE.wireName());
            ps.setString(2, error);
            setInstant(ps, 3, finishedAt);
            setInstant(ps, 4, finishedAt);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("finalizing interrupted runs failed", e);
        }
    }

    private void insert(JobLog log) {
        String sql = "INSERT INTO job_logs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, UUID.fromString(log.getId()));
            ps.setObject(2, UUID.fromString(log.getJobId()));
            setInstant(ps, 3, log.getStartedAt());
            setInstant(ps, 4, log.getFinishedAt());
            setLong(ps, 5, log.getDurationMs());
            ps.setString(6, log.getStatus().wireName());
            setInteger(ps, 7, log.getResponseCode());
            ps.setString(8, log.getError());
            ps.setString(9, log.getResponseBody());
            ps.setInt(10, log.getAttempts());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("insert log for job " + log.getJobId() + " failed", e);
        }
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private JobLog map(ResultSet rs) throws SQLException {
        return JobLog.builder()
                .id(rs.getObject("id").toString())
                .jobId(rs.getObject("job_id").toString())
                .startedAt(getInstant(rs, "started_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .durationMs(getLong(rs, "duration_ms"))
                .status(JobLogStatus.fromWireName(rs.getString("status")))
                .responseCode(getInteger(rs, "response_code"))
                .error(rs.getString("error"))
                .responseBody(rs.getString("response_body"))
                .attempts(rs.getInt("attempts"))
                .build();
    }
}
