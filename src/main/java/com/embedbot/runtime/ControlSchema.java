package com.embedbot.runtime;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent DDL for the control database: tenants, their credentials, failed validation
 * attempts and uploaded files.
 */
public final class ControlSchema {
    private static final Logger log = LoggerFactory.getLogger(ControlSchema.class);

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS tenants (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                chat_id BIGINT NOT NULL UNIQUE,
                username VARCHAR(255),
                display_name VARCHAR(255),
                phone VARCHAR(32),
                onboarding_state VARCHAR(32) NOT NULL,
                created_at TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS credentials (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                tenant_id BIGINT NOT NULL UNIQUE REFERENCES tenants (id),
                store_host VARCHAR(255) NOT NULL,
                store_port INT NOT NULL,
                store_database VARCHAR(255) NOT NULL,
                store_user VARCHAR(255) NOT NULL,
                store_password_ciphertext VARCHAR(4096) NOT NULL,
                provider_key_ciphertext VARCHAR(4096) NOT NULL,
                provider_key_fingerprint VARCHAR(64) NOT NULL,
                table_name VARCHAR(63) NOT NULL,
                last_validated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                created_at TIMESTAMP WITH TIME ZONE NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS validation_events (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                tenant_id BIGINT NOT NULL REFERENCES tenants (id),
                field_name VARCHAR(64) NOT NULL,
                reason_code VARCHAR(64) NOT NULL,
                created_at TIMESTAMP WITH TIME ZONE NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS uploaded_files (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                tenant_id BIGINT NOT NULL REFERENCES tenants (id),
                file_name VARCHAR(512) NOT NULL,
                size_bytes BIGINT NOT NULL,
                storage_key VARCHAR(1024) NOT NULL,
                status VARCHAR(16) NOT NULL,
                error_message VARCHAR(2048),
                uploaded_at TIMESTAMP WITH TIME ZONE NOT NULL,
                processed_at TIMESTAMP WITH TIME ZONE
            )""",
            "CREATE INDEX IF NOT EXISTS uploaded_files_tenant_idx ON uploaded_files (tenant_id, uploaded_at)");

    private ControlSchema() {
    }

    public static void initialize(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            for (String ddl : STATEMENTS) {
                statement.execute(ddl);
            }
            log.info("control.schema.ready tables=4");
        } catch (SQLException e) {
            throw new PersistenceException("Unable to initialise control schema", e);
        }
    }
}
