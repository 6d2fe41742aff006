package com.embedbot.vectorstore;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.H2Databases;
import com.embedbot.tenant.CredentialBundle;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.StoreParams;
import com.embedbot.tenant.TableNames;
import com.embedbot.tenant.Tenant;
import com.embedbot.tenant.TestCiphers;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorStoreRouterTest {
    private static final int DIMENSIONS = 3;

    private JdbcTenantRegistry registry;
    private VectorStoreRouter router;

    @BeforeEach
    void setUp() {
        registry = new JdbcTenantRegistry(H2Databases.controlDatabase(), TestCiphers.aes(),
                new AppConfig.FallbackConfig());
        router = routerWith(H2VectorStoreDialect.standard());
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    void shouldProvisionOnceAndAllowRepeatCalls() {
        Tenant tenant = TestStores.onboard(registry, 1L);

        router.ensureSchema(tenant);

        assertDoesNotThrow(() -> router.ensureSchema(tenant));
        assertEquals(0, router.count(tenant, 1L));
    }

    @Test
    void shouldWriteAndReadSegmentsInOrder() {
        Tenant tenant = TestStores.onboard(registry, 1L);

        router.write(tenant, 5L, List.of(
                record(0, "a.txt", 5L, "First segment."),
                record(1, "a.txt", 5L, "Second segment.")));

        List<StoredSegment> stored = router.read(tenant, 5L);
        assertEquals(2, stored.size());
        assertEquals("a.txt|5|0", stored.get(0).title());
        assertEquals("Second segment.", stored.get(1).body());
        assertArrayEquals(new float[] {1.0f, 0.5f, 0.25f}, stored.get(1).vector());
    }

    @Test
    void shouldReplacePreviousRowsOfTheSameFile() {
        Tenant tenant = TestStores.onboard(registry, 1L);
        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "one"), record(1, "a.txt", 5L, "two"),
                record(2, "a.txt", 5L, "three")));
        router.write(tenant, 6L, List.of(record(0, "b.txt", 6L, "other file")));

        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "replacement")));

        assertEquals(1, router.count(tenant, 5L));
        assertEquals("replacement", router.read(tenant, 5L).get(0).body());
        assertEquals(1, router.count(tenant, 6L));
    }

    @Test
    void shouldKeepTenantsInSeparateStores() {
        Tenant alice = TestStores.onboard(registry, 1L);
        Tenant bob = TestStores.onboard(registry, 2L);

        router.write(alice, 5L, List.of(record(0, "a.txt", 5L, "alice data")));

        assertEquals(1, router.count(alice, 5L));
        assertEquals(0, router.count(bob, 5L));
    }

    @Test
    void shouldReprovisionWhenTableWasDroppedExternally() throws SQLException {
        Tenant tenant = TestStores.onboard(registry, 1L);
        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "before drop")));
        dropTable(tenant);

        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "after drop")));

        assertEquals("after drop", router.read(tenant, 5L).get(0).body());
    }

    @Test
    void shouldRaiseSchemaErrorWhenRecoveryCannotCreateTable() {
        router.close();
        router = routerWith(H2VectorStoreDialect.withoutProvisioning());
        Tenant tenant = TestStores.onboard(registry, 1L);

        assertThrows(SchemaException.class,
                () -> router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "never stored"))));
    }

    @Test
    void shouldRaiseSchemaErrorWhenProvisioningFails() {
        router.close();
        router = routerWith(H2VectorStoreDialect.failingProvisioning());
        Tenant tenant = TestStores.onboard(registry, 1L);

        assertThrows(SchemaException.class, () -> router.ensureSchema(tenant));
    }

    @Test
    void shouldEmptyTableOnReset() {
        Tenant tenant = TestStores.onboard(registry, 1L);
        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "to be dropped")));

        router.resetSchema(tenant);

        assertEquals(0, router.count(tenant, 5L));
    }

    @Test
    void shouldClosePoolWhenCredentialIsRotated() {
        Tenant tenant = TestStores.onboard(registry, 1L);
        registry.addListener(router);
        router.ensureSchema(tenant);
        assertTrue(router.hasPool(tenant));
        String database = registry.credential(tenant).orElseThrow().store().database();

        registry.rotateKey(tenant, new CredentialBundle(null,
                new StoreParams("localhost", 5432, database, TestStores.STORE_USER),
                TestStores.STORE_PASSWORD, "sk-rotated-0123456789abcdef"));

        assertFalse(router.hasPool(tenant));
        router.write(tenant, 5L, List.of(record(0, "a.txt", 5L, "after rotation")));
        assertEquals(1, router.count(tenant, 5L));
    }

    private VectorStoreRouter routerWith(VectorStoreDialect dialect) {
        return new VectorStoreRouter(registry, dialect, new HikariTenantDataSourceFactory(dialect, 2), DIMENSIONS);
    }

    private void dropTable(Tenant tenant) throws SQLException {
        String database = registry.credential(tenant).orElseThrow().store().database();
        try (Connection connection = DriverManager.getConnection(H2Databases.url(database),
                TestStores.STORE_USER, TestStores.STORE_PASSWORD);
                Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE " + TableNames.forTenant(tenant.id()));
        }
    }

    private static SegmentRecord record(int index, String fileName, long fileId, String body) {
        return new SegmentRecord(index, SegmentRecord.title(fileName, fileId, index), body,
                new float[] {1.0f, 0.5f, 0.25f});
    }
}
