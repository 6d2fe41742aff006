package com.embedbot.onboarding;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.tenant.StoreParams;
import com.embedbot.vectorstore.VectorStoreDialect;

/**
 * Opens one short-lived read-only connection, runs {@code SELECT 1} and the dialect's
 * capability query.
 */
public class JdbcStoreProbe implements StoreProbe {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreProbe.class);

    private final VectorStoreDialect dialect;
    private final int timeoutSeconds;

    public JdbcStoreProbe(VectorStoreDialect dialect, int timeoutSeconds) {
        this.dialect = dialect;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void probe(StoreParams store, String password) {
        Properties properties = new Properties();
        properties.setProperty("user", store.user());
        properties.setProperty("password", password);
        dialect.applyTimeout(properties, timeoutSeconds);
        try (Connection connection = DriverManager.getConnection(dialect.jdbcUrl(store), properties)) {
            connection.setReadOnly(true);
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds);
                try (ResultSet ping = statement.executeQuery("SELECT 1")) {
                    ping.next();
                }
                try (ResultSet capability = statement.executeQuery(dialect.capabilityQuery())) {
                    if (!capability.next()) {
                        throw new MissingCapabilityException(
                                "The database does not offer the 'vector' extension. Enable pgvector and try again.");
                    }
                }
            }
        } catch (SQLException e) {
            log.warn("onboarding.store.probe.failed host={} port={} sqlState={}", store.host(), store.port(),
                    e.getSQLState());
            throw classify(e);
        }
        log.info("onboarding.store.probe.ok host={} port={}", store.host(), store.port());
    }

    static ValidationException classify(SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        if (state.equals("28P01") || state.equals("28000")) {
            return new ValidationException(OnboardingField.STORE_PASSWORD, ValidationReason.STORE_AUTH_FAILED,
                    "The database rejected the user name or password.", e);
        }
        if (state.equals("3D000")) {
            return new ValidationException(OnboardingField.STORE_DATABASE, ValidationReason.UNKNOWN_DATABASE,
                    "The database does not exist on that server.", e);
        }
        return new ValidationException(OnboardingField.STORE_HOST, ValidationReason.UNREACHABLE,
                "Unable to connect to the database server. Check the host and port.", e);
    }
}
