package com.p14n.eventhub.db;

import com.p14n.eventhub.data.HubConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseSetup(HubConfig cfg) {
        this(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }

    public DatabaseSetup(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createRecordsTableIfNotExists();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS eventhub");
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createRecordsTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS eventhub.event_records (
                        idn bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        id VARCHAR(64) NOT NULL UNIQUE,
                        subscriber_id VARCHAR(255) NOT NULL,
                        event_type VARCHAR(1024) NOT NULL,
                        payload bytea,
                        is_complete boolean NOT NULL DEFAULT false,
                        expire_on TIMESTAMP WITH TIME ZONE NOT NULL
                    )""");
            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS event_records_pending_idx
                    ON eventhub.event_records (event_type, subscriber_id, is_complete, idn)""");
            logger.atInfo().log("Event records table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating event records table");
            throw new RuntimeException("Failed to create event_records table", e);
        }
        return this;
    }

    private Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

    public static DataSource createPool(HubConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        return ds;
    }
}
