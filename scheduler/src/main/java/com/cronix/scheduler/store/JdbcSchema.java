package com.cronix.scheduler.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import javax.sql.DataSource;

import com.cronix.scheduler.exception.StoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies {@code db/schema.sql} from the classpath. Every statement is idempotent.
 */
@Slf4j
public final class JdbcSchema {
    public static final String RESOURCE = "db/schema.sql";

    private JdbcSchema() {
    }

    public static void apply(DataSource ds) {
        String script = load();
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    st.execute(sql);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("failed to apply schema", e);
        }
        log.info("Database schema applied");
    }

    private static String load() {
        try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(RESOURCE + " not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + RESOURCE, e);
        }
    }
}
