package com.embedbot.vectorstore;

import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.runtime.PersistenceException;
import com.embedbot.tenant.CredentialListener;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.TableNames;
import com.embedbot.tenant.Tenant;

/**
 * Routes segment writes and reads to each tenant's own store and table. Connection pools are
 * opened lazily per tenant and closed when the tenant's credential is replaced.
 */
public class VectorStoreRouter implements CredentialListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreRouter.class);

    private final JdbcTenantRegistry registry;
    private final VectorStoreDialect dialect;
    private final TenantDataSourceFactory dataSourceFactory;
    private final int dimensions;
    private final Map<Long, TenantStore> stores = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<Long> provisioned = ConcurrentHashMap.newKeySet();

    public VectorStoreRouter(JdbcTenantRegistry registry,
            VectorStoreDialect dialect,
            TenantDataSourceFactory dataSourceFactory,
            int dimensions) {
        this.registry = registry;
        this.dialect = dialect;
        this.dataSourceFactory = dataSourceFactory;
        this.dimensions = dimensions;
    }

    /**
     * Creates the extension, table and index for the tenant if needed. Repeat calls after a
     * successful provisioning do not touch the database.
     */
    public void ensureSchema(Tenant tenant) {
        if (provisioned.contains(tenant.id())) {
            return;
        }
        ReentrantLock lock = lockFor(tenant);
        lock.lock();
        try {
            if (provisioned.contains(tenant.id())) {
                return;
            }
            TenantStore store = storeFor(tenant);
            try (Connection connection = store.dataSource().getConnection();
                    Statement statement = connection.createStatement()) {
                for (String ddl : dialect.provisionStatements(store.table(), dimensions)) {
                    statement.execute(ddl);
                }
            } catch (SQLException e) {
                throw new SchemaException("Unable to provision segment table for tenant " + tenant.id(), e);
            }
            provisioned.add(tenant.id());
            log.info("vectorstore.schema.ready tenantId={} table={} dimensions={}", tenant.id(), store.table(),
                    dimensions);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces every stored row of {@code fileId} with {@code records} in one transaction.
     */
    public void write(Tenant tenant, long fileId, List<SegmentRecord> records) {
        int written = withRecovery(tenant, "write", store -> {
            try (Connection connection = store.dataSource().getConnection()) {
                connection.setAutoCommit(false);
                try {
                    try (PreparedStatement delete = connection.prepareStatement(
                            "DELETE FROM " + store.table() + " WHERE file_id = ?")) {
                        delete.setLong(1, fileId);
                        delete.executeUpdate();
                    }
                    try (PreparedStatement insert = connection.prepareStatement(
                            "INSERT INTO " + store.table() + " (file_id, segment_index, title, body, embedding) "
                                    + "VALUES (?, ?, ?, ?, " + dialect.vectorParameter() + ")")) {
                        for (SegmentRecord record : records) {
                            insert.setLong(1, fileId);
                            insert.setInt(2, record.index());
                            insert.setString(3, record.title());
                            insert.setString(4, record.body());
                            insert.setString(5, VectorLiterals.format(record.vector()));
                            insert.addBatch();
                        }
                        insert.executeBatch();
                    }
                    connection.commit();
                } catch (SQLException e) {
                    connection.rollback();
                    throw e;
                }
            }
            return records.size();
        });
        log.info("vectorstore.write tenantId={} fileId={} rows={}", tenant.id(), fileId, written);
    }

    public List<StoredSegment> read(Tenant tenant, long fileId) {
        return withRecovery(tenant, "read", store -> {
            List<StoredSegment> segments = new ArrayList<>();
            try (Connection connection = store.dataSource().getConnection();
                    PreparedStatement select = connection.prepareStatement(
                            "SELECT id, file_id, segment_index, title, body, " + dialect.vectorSelect()
                                    + " FROM " + store.table() + " WHERE file_id = ? ORDER BY segment_index")) {
                select.setLong(1, fileId);
                try (ResultSet rows = select.executeQuery()) {
                    while (rows.next()) {
                        segments.add(new StoredSegment(
                                rows.getLong("id"),
                                rows.getLong("file_id"),
                                rows.getInt("segment_index"),
                                rows.getString("title"),
                                rows.getString("body"),
                                VectorLiterals.parse(rows.getString("embedding"))));
                    }
                }
            }
            return segments;
        });
    }

    public int count(Tenant tenant, long fileId) {
        return withRecovery(tenant, "count", store -> {
            try (Connection connection = store.dataSource().getConnection();
                    PreparedStatement select = connection.prepareStatement(
                            "SELECT COUNT(*) FROM " + store.table() + " WHERE file_id = ?")) {
                select.setLong(1, fileId);
                try (ResultSet rows = select.executeQuery()) {
                    rows.next();
                    return rows.getInt(1);
                }
            }
        });
    }

    /**
     * Drops the tenant's segment table and provisions it again. Every stored segment is lost.
     */
    public void resetSchema(Tenant tenant) {
        ReentrantLock lock = lockFor(tenant);
        lock.lock();
        try {
            TenantStore store = storeFor(tenant);
            try (Connection connection = store.dataSource().getConnection();
                    Statement statement = connection.createStatement()) {
                statement.execute(dialect.dropStatement(store.table()));
            } catch (SQLException e) {
                throw new SchemaException("Unable to drop segment table for tenant " + tenant.id(), e);
            }
            provisioned.remove(tenant.id());
            log.warn("vectorstore.schema.dropped tenantId={} table={}", tenant.id(), store.table());
        } finally {
            lock.unlock();
        }
        ensureSchema(tenant);
    }

    /**
     * Closes the tenant's pool; the next operation reopens it with the current credential.
     */
    public void invalidate(Tenant tenant) {
        ReentrantLock lock = lockFor(tenant);
        lock.lock();
        try {
            TenantStore removed = stores.remove(tenant.id());
            provisioned.remove(tenant.id());
            if (removed != null) {
                closeQuietly(tenant.id(), removed);
                log.info("vectorstore.pool.closed tenantId={}", tenant.id());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void credentialReplaced(Tenant tenant) {
        invalidate(tenant);
    }

    boolean hasPool(Tenant tenant) {
        return stores.containsKey(tenant.id());
    }

    @Override
    public void close() {
        for (Map.Entry<Long, TenantStore> entry : stores.entrySet()) {
            closeQuietly(entry.getKey(), entry.getValue());
        }
        stores.clear();
        provisioned.clear();
    }

    private <T> T withRecovery(Tenant tenant, String operation, StoreWork<T> work) {
        ensureSchema(tenant);
        TenantStore store = storeFor(tenant);
        try {
            return work.run(store);
        } catch (SQLException e) {
            if (!dialect.isMissingRelation(e)) {
                throw new PersistenceException("Vector store " + operation + " failed for tenant " + tenant.id(), e);
            }
            log.warn("vectorstore.relation.missing tenantId={} table={} operation={} action=reprovision",
                    tenant.id(), store.table(), operation);
        }
        provisioned.remove(tenant.id());
        ensureSchema(tenant);
        try {
            return work.run(store);
        } catch (SQLException e) {
            if (dialect.isMissingRelation(e)) {
                throw new SchemaException("Segment table of tenant " + tenant.id() + " is still missing after recovery",
                        e);
            }
            throw new PersistenceException("Vector store " + operation + " failed for tenant " + tenant.id(), e);
        }
    }

    private TenantStore storeFor(Tenant tenant) {
        TenantStore existing = stores.get(tenant.id());
        if (existing != null) {
            return existing;
        }
        ReentrantLock lock = lockFor(tenant);
        lock.lock();
        try {
            TenantStore store = stores.get(tenant.id());
            if (store == null) {
                store = registry.withDecrypted(tenant, credential -> new TenantStore(
                        dataSourceFactory.create(credential), TableNames.requireSafe(credential.tableName())));
                stores.put(tenant.id(), store);
                log.info("vectorstore.pool.opened tenantId={} table={}", tenant.id(), store.table());
            }
            return store;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Tenant tenant) {
        return locks.computeIfAbsent(tenant.id(), id -> new ReentrantLock());
    }

    private static void closeQuietly(long tenantId, TenantStore store) {
        if (store.dataSource() instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("vectorstore.pool.close.failed tenantId={} error={}", tenantId, e.getMessage());
            }
        }
    }

    @FunctionalInterface
    private interface StoreWork<T> {
        T run(TenantStore store) throws SQLException;
    }

    private record TenantStore(DataSource dataSource, String table) {
    }
}
