package com.embedbot.vectorstore;

import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import com.embedbot.tenant.StoreParams;

/**
 * SQL that differs between vector store engines.
 */
public interface VectorStoreDialect {

    String jdbcUrl(StoreParams store);

    /**
     * Idempotent statements creating the extension, segment table and lookup index.
     */
    List<String> provisionStatements(String table, int dimensions);

    default String dropStatement(String table) {
        return "DROP TABLE IF EXISTS " + table;
    }

    /**
     * Placeholder expression binding a vector literal such as {@code [0.1,0.2]}.
     */
    String vectorParameter();

    /**
     * Select expression returning the embedding column as a vector literal string.
     */
    String vectorSelect();

    boolean isMissingRelation(SQLException e);

    /**
     * Query returning at least one row when the store can hold vectors.
     */
    String capabilityQuery();

    /**
     * Adds driver properties bounding connect and read time for a probe connection.
     */
    default void applyTimeout(Properties properties, int seconds) {
    }
}
