package com.embedbot.vectorstore;

import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.embedbot.tenant.StoreParams;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PgVectorDialectTest {
    private final PgVectorDialect dialect = new PgVectorDialect("require");

    @Test
    void shouldBuildJdbcUrlWithSslMode() {
        assertEquals("jdbc:postgresql://db.example.com:6543/vectors?sslmode=require&ApplicationName=embedbot",
                dialect.jdbcUrl(new StoreParams("db.example.com", 6543, "vectors", "alice")));
    }

    @Test
    void shouldEncodeDatabaseNameInJdbcUrl() {
        assertEquals("jdbc:postgresql://db.example.com:5432/x%3Fsslmode%3Ddisable%26?sslmode=require"
                        + "&ApplicationName=embedbot",
                dialect.jdbcUrl(new StoreParams("db.example.com", 5432, "x?sslmode=disable&", "alice")));
    }

    @Test
    void shouldProvisionExtensionTableAndIndexWithConfiguredDimensions() {
        List<String> statements = dialect.provisionStatements("tenant_7_segments", 1536);

        assertEquals("CREATE EXTENSION IF NOT EXISTS vector", statements.get(0));
        assertTrue(statements.get(1).contains("embedding vector(1536) NOT NULL"));
        assertTrue(statements.get(2).contains("tenant_7_segments_file_idx"));
    }

    @Test
    void shouldDetectUndefinedTableAnywhereInCauseChain() {
        SQLException undefined = new SQLException("relation does not exist", "42P01");
        SQLException wrapped = new SQLException("batch failed", "XX000", undefined);

        assertTrue(dialect.isMissingRelation(wrapped));
        assertFalse(dialect.isMissingRelation(new SQLException("duplicate", "23505")));
    }

    @Test
    void shouldBoundProbeTimeouts() {
        Properties properties = new Properties();

        dialect.applyTimeout(properties, 5);

        assertEquals("5", properties.getProperty("connectTimeout"));
        assertEquals("5", properties.getProperty("socketTimeout"));
    }
}
