package com.embedbot.vectorstore;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import com.embedbot.tenant.StoreParams;

public class PgVectorDialect implements VectorStoreDialect {
    private static final String UNDEFINED_TABLE = "42P01";

    private final String sslMode;

    public PgVectorDialect(String sslMode) {
        this.sslMode = sslMode == null || sslMode.isBlank() ? "prefer" : sslMode;
    }

    @Override
    public String jdbcUrl(StoreParams store) {
        return "jdbc:postgresql://" + store.host() + ":" + store.port() + "/"
                + URLEncoder.encode(store.database(), StandardCharsets.UTF_8)
                + "?sslmode=" + sslMode + "&ApplicationName=embedbot";
    }

    @Override
    public List<String> provisionStatements(String table, int dimensions) {
        return List.of(
                "CREATE EXTENSION IF NOT EXISTS vector",
                "CREATE TABLE IF NOT EXISTS " + table + " ("
                        + "id BIGSERIAL PRIMARY KEY, "
                        + "file_id BIGINT NOT NULL, "
                        + "segment_index INT NOT NULL, "
                        + "title TEXT NOT NULL, "
                        + "body TEXT NOT NULL, "
                        + "embedding vector(" + dimensions + ") NOT NULL)",
                "CREATE INDEX IF NOT EXISTS " + table + "_file_idx ON " + table + " (file_id, segment_index)");
    }

    @Override
    public String vectorParameter() {
        return "CAST(? AS vector)";
    }

    @Override
    public String vectorSelect() {
        return "embedding::text AS embedding";
    }

    @Override
    public String capabilityQuery() {
        return "SELECT 1 FROM pg_available_extensions WHERE name = 'vector'";
    }

    @Override
    public void applyTimeout(Properties properties, int seconds) {
        properties.setProperty("connectTimeout", Integer.toString(seconds));
        properties.setProperty("loginTimeout", Integer.toString(seconds));
        properties.setProperty("socketTimeout", Integer.toString(seconds));
    }

    @Override
    public boolean isMissingRelation(SQLException e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof SQLException sql && UNDEFINED_TABLE.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
