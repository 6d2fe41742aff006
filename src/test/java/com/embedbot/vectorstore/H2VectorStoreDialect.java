package com.embedbot.vectorstore;

import java.sql.SQLException;
import java.util.List;

import com.embedbot.runtime.H2Databases;
import com.embedbot.tenant.StoreParams;

/**
 * Stores vectors as text literals in an in-memory H2 database named after the store's database.
 */
public class H2VectorStoreDialect implements VectorStoreDialect {
    private static final int TABLE_NOT_FOUND = 42102;
    private static final int TABLE_NOT_FOUND_WITH_CANDIDATES = 42103;
    private static final int TABLE_NOT_FOUND_DATABASE_EMPTY = 42104;

    private final boolean provisions;
    private final boolean provisioningFails;
    private final boolean vectorCapable;

    private H2VectorStoreDialect(boolean provisions, boolean provisioningFails, boolean vectorCapable) {
        this.provisions = provisions;
        this.provisioningFails = provisioningFails;
        this.vectorCapable = vectorCapable;
    }

    public static H2VectorStoreDialect standard() {
        return new H2VectorStoreDialect(true, false, true);
    }

    /** Provisioning succeeds without creating anything, so the table stays missing. */
    public static H2VectorStoreDialect withoutProvisioning() {
        return new H2VectorStoreDialect(false, false, true);
    }

    public static H2VectorStoreDialect failingProvisioning() {
        return new H2VectorStoreDialect(true, true, true);
    }

    public static H2VectorStoreDialect withoutVectorCapability() {
        return new H2VectorStoreDialect(true, false, false);
    }

    @Override
    public String jdbcUrl(StoreParams store) {
        return H2Databases.url(store.database());
    }

    @Override
    public List<String> provisionStatements(String table, int dimensions) {
        if (!provisions) {
            return List.of();
        }
        if (provisioningFails) {
            return List.of("CREATE TABLE " + table + " (broken");
        }
        return List.of(
                "CREATE TABLE IF NOT EXISTS " + table + " ("
                        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                        + "file_id BIGINT NOT NULL, "
                        + "segment_index INT NOT NULL, "
                        + "title VARCHAR(1024) NOT NULL, "
                        + "body CLOB NOT NULL, "
                        + "embedding CLOB NOT NULL)",
                "CREATE INDEX IF NOT EXISTS " + table + "_file_idx ON " + table + " (file_id, segment_index)");
    }

    @Override
    public String vectorParameter() {
        return "?";
    }

    @Override
    public String vectorSelect() {
        return "embedding";
    }

    @Override
    public boolean isMissingRelation(SQLException e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof SQLException sql) {
                int code = sql.getErrorCode();
                if (code == TABLE_NOT_FOUND || code == TABLE_NOT_FOUND_WITH_CANDIDATES
                        || code == TABLE_NOT_FOUND_DATABASE_EMPTY) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String capabilityQuery() {
        return vectorCapable ? "SELECT 1" : "SELECT 1 FROM INFORMATION_SCHEMA.TABLES WHERE 1 = 0";
    }
}
