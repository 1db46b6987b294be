package com.cronix.scheduler.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.testcontainers.containers.PostgreSQLContainer;

import com.cronix.scheduler.server.ApiJson;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class JdbcStoreIT extends StoreContract {
    private static PostgreSQLContainer<?> pg;
    private static HikariDataSource ds;

    @BeforeClass
    public static void setup() {
        pg = new PostgreSQLContainer<>("postgres:15");
        pg.start();

        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(pg.getJdbcUrl());
        hc.setUsername(pg.getUsername());
        hc.setPassword(pg.getPassword());
        ds = new HikariDataSource(hc);
        JdbcSchema.apply(ds);
    }

    @AfterClass
    public static void teardown() {
        if (ds != null)
            ds.close();
        if (pg != null)
            pg.stop();
    }

    @Override
    protected Stores newStores() {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("TRUNCATE users CASCADE");
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        // the schema script is idempotent
        JdbcSchema.apply(ds);
        return new Stores(new JdbcJobStore(ds, ApiJson.newMapper()), new JdbcLogRecorder(ds), new JdbcUserStore(ds),
                null);
    }
}
