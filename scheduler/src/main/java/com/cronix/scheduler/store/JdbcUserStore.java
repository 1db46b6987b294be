package com.cronix.scheduler.store;

import static com.cronix.scheduler.store.JdbcSupport.getInstant;
import static com.cronix.scheduler.store.JdbcSupport.setInstant;
import static com.cronix.scheduler.store.JdbcSupport.uuid;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import javax.sql.DataSource;

import com.cronix.scheduler.domain.User;
import com.cronix.scheduler.exception.StoreException;

public class JdbcUserStore implements UserStore {
    private final DataSource ds;

    public JdbcUserStore(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public Optional<User> findById(String id) {
        UUID key = uuid(id);
        if (key == null) {
            return Optional.empty();
        }
        String sql = "SELECT id, email, name, avatar_url, provider, created_at FROM users WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(User.builder()
                        .id(rs.getObject("id").toString())
                        .email(rs.getString("email"))
                        .name(rs.getString("name"))
                        .avatarUrl(rs.getString("avatar_url"))
                        .provider(rs.getString("provider"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build());
            }
        } catch (SQLException e) {
            throw new StoreException("load user " + id + " failed", e);
        }
    }

    @Override
    public User upsert(User user) {
        String sql = "INSERT INTO users (id, email, name, avatar_url, provider, created_at) VALUES (?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (id) DO UPDATE SET email = EXCLUDED.email, name = EXCLUDED.name, "
                + "avatar_url = EXCLUDED.avatar_url";
        Instant createdAt = user.getCreatedAt() == null ? Instant.now() : user.getCreatedAt();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, UUID.fromString(user.getId()));
            ps.setString(2, user.getEmail());
            ps.setString(3, user.getName());
            ps.setString(4, user.getAvatarUrl());
            ps.setString(5, user.getProvider() == null ? "google" : user.getProvider());
            setInstant(ps, 6, createdAt);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("upsert user " + user.getId() + " failed", e);
        }
        return findById(user.getId()).orElseThrow(() -> new StoreException("user " + user.getId() + " vanished", null));
    }
}
