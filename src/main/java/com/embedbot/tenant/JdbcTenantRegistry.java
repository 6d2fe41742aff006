package com.embedbot.tenant;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.embedding.ApiKeys;
import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.PersistenceException;

/**
 * Tenants and their credentials in the control database. Secrets are written encrypted and
 * only ever exposed in plaintext for the duration of a {@link #withDecrypted} callback.
 */
public class JdbcTenantRegistry {
    private static final Logger log = LoggerFactory.getLogger(JdbcTenantRegistry.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String TENANT_COLUMNS =
            "id, chat_id, username, display_name, phone, onboarding_state, created_at, updated_at";
    private static final String CREDENTIAL_COLUMNS = "id, tenant_id, store_host, store_port, store_database, "
            + "store_user, store_password_ciphertext, provider_key_ciphertext, provider_key_fingerprint, "
            + "table_name, last_validated_at, created_at";

    private final DataSource dataSource;
    private final SecretCipher cipher;
    private final AppConfig.FallbackConfig fallback;
    private final Clock clock;
    private final List<CredentialListener> listeners = new CopyOnWriteArrayList<>();

    public JdbcTenantRegistry(DataSource dataSource, SecretCipher cipher, AppConfig.FallbackConfig fallback) {
        this(dataSource, cipher, fallback, Clock.systemUTC());
    }

    JdbcTenantRegistry(DataSource dataSource, SecretCipher cipher, AppConfig.FallbackConfig fallback, Clock clock) {
        this.dataSource = dataSource;
        this.cipher = cipher;
        this.fallback = fallback == null ? new AppConfig.FallbackConfig() : fallback;
        this.clock = clock;
    }

    public void addListener(CredentialListener listener) {
        listeners.add(listener);
    }

    public Optional<Tenant> find(long chatId) {
        try (Connection connection = dataSource.getConnection()) {
            return findByChatId(connection, chatId);
        } catch (SQLException e) {
            throw new PersistenceException("Unable to look up tenant for chat " + chatId, e);
        }
    }

    public Tenant require(long chatId) {
        return find(chatId).orElseThrow(() -> new TenantNotFoundException("No tenant for chat " + chatId));
    }

    /**
     * Returns the tenant for a chat session, creating it on first contact. Display metadata is
     * refreshed when it changed; the chat id itself never does.
     */
    public Tenant getOrCreate(long chatId, String username, String displayName) {
        try (Connection connection = dataSource.getConnection()) {
            Optional<Tenant> existing = findByChatId(connection, chatId);
            if (existing.isPresent()) {
                return refreshMetadata(connection, existing.get(), username, displayName);
            }
            OffsetDateTime now = now();
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO tenants (chat_id, username, display_name, onboarding_state, created_at, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?)")) {
                insert.setLong(1, chatId);
                insert.setString(2, username);
                insert.setString(3, displayName);
                insert.setString(4, OnboardingState.COLLECTING_IDENTITY.name());
                insert.setObject(5, now);
                insert.setObject(6, now);
                insert.executeUpdate();
            } catch (SQLException e) {
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw e;
                }
                log.debug("tenant.create.race chatId={}", chatId);
            }
            Tenant tenant = findByChatId(connection, chatId)
                    .orElseThrow(() -> new TenantNotFoundException("Tenant vanished after insert for chat " + chatId));
            log.info("tenant.created tenantId={} chatId={}", tenant.id(), chatId);
            return tenant;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to create tenant for chat " + chatId, e);
        }
    }

    public Tenant updateState(Tenant tenant, OnboardingState state) {
        OffsetDateTime now = now();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement update = connection.prepareStatement(
                        "UPDATE tenants SET onboarding_state = ?, updated_at = ? WHERE id = ?")) {
            update.setString(1, state.name());
            update.setObject(2, now);
            update.setLong(3, tenant.id());
            if (update.executeUpdate() == 0) {
                throw new TenantNotFoundException("No tenant with id " + tenant.id());
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to update onboarding state of tenant " + tenant.id(), e);
        }
        log.info("tenant.state tenantId={} from={} to={}", tenant.id(), tenant.onboardingState(), state);
        return new Tenant(tenant.id(), tenant.chatId(), tenant.username(), tenant.displayName(), tenant.phone(),
                state, tenant.createdAt(), now);
    }

    public Optional<Credential> credential(Tenant tenant) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = connection.prepareStatement(
                        "SELECT " + CREDENTIAL_COLUMNS + " FROM credentials WHERE tenant_id = ?")) {
            select.setLong(1, tenant.id());
            try (ResultSet rows = select.executeQuery()) {
                return rows.next() ? Optional.of(mapCredential(rows)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to read credential of tenant " + tenant.id(), e);
        }
    }

    /**
     * Persists a validated bundle and marks the tenant {@link OnboardingState#COMPLETE} in one
     * transaction. A previous credential row is removed, so its ciphertext does not survive.
     * Listeners are notified so store connections opened with the old credential, or with the
     * fallback, are closed.
     */
    public Tenant upsertCredential(Tenant tenant, CredentialBundle bundle) {
        Tenant updated = replaceCredential(tenant, bundle);
        log.info("tenant.credential.stored tenantId={} fingerprint={}", tenant.id(),
                shortFingerprint(bundle.providerApiKey()));
        notifyReplaced(updated);
        return updated;
    }

    /**
     * Same replacement as {@link #upsertCredential}, used when only the provider key changes.
     */
    public Tenant rotateKey(Tenant tenant, CredentialBundle bundle) {
        Tenant updated = replaceCredential(tenant, bundle);
        log.info("tenant.credential.rotated tenantId={} fingerprint={}", tenant.id(),
                shortFingerprint(bundle.providerApiKey()));
        notifyReplaced(updated);
        return updated;
    }

    /**
     * Puts back a credential row read earlier with {@link #credential}, replacing whatever is
     * stored now. The ciphertexts are copied as they are. The tenant state is not touched.
     */
    public void restoreCredential(Tenant tenant, Credential previous) {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                deleteCredential(connection, tenant.id());
                try (PreparedStatement insert = connection.prepareStatement(
                        "INSERT INTO credentials (tenant_id, store_host, store_port, store_database, store_user, "
                                + "store_password_ciphertext, provider_key_ciphertext, provider_key_fingerprint, "
                                + "table_name, last_validated_at, created_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    insert.setLong(1, tenant.id());
                    insert.setString(2, previous.store().host());
                    insert.setInt(3, previous.store().port());
                    insert.setString(4, previous.store().database());
                    insert.setString(5, previous.store().user());
                    insert.setString(6, previous.storePasswordCiphertext());
                    insert.setString(7, previous.providerKeyCiphertext());
                    insert.setString(8, previous.providerKeyFingerprint());
                    insert.setString(9, previous.tableName());
                    insert.setObject(10, previous.lastValidatedAt());
                    insert.setObject(11, previous.createdAt());
                    insert.executeUpdate();
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to restore credential of tenant " + tenant.id(), e);
        }
        log.info("tenant.credential.restored tenantId={} fingerprint={}", tenant.id(),
                previous.providerKeyFingerprint().substring(0, 12));
        notifyReplaced(tenant);
    }

    /**
     * Deletes the tenant's credential row, if any. The tenant state is not touched.
     */
    public void removeCredential(Tenant tenant) {
        try (Connection connection = dataSource.getConnection()) {
            deleteCredential(connection, tenant.id());
        } catch (SQLException e) {
            throw new PersistenceException("Unable to remove credential of tenant " + tenant.id(), e);
        }
        log.info("tenant.credential.removed tenantId={}", tenant.id());
        notifyReplaced(tenant);
    }

    public void recordValidationFailure(Tenant tenant, String fieldName, String reasonCode) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement insert = connection.prepareStatement(
                        "INSERT INTO validation_events (tenant_id, field_name, reason_code, created_at) "
                                + "VALUES (?, ?, ?, ?)")) {
            insert.setLong(1, tenant.id());
            insert.setString(2, fieldName);
            insert.setString(3, reasonCode);
            insert.setObject(4, now());
            insert.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Unable to record validation failure of tenant " + tenant.id(), e);
        }
        log.warn("onboarding.validation.failed tenantId={} field={} reason={}", tenant.id(), fieldName, reasonCode);
    }

    public List<ValidationEvent> validationEvents(Tenant tenant) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = connection.prepareStatement(
                        "SELECT id, tenant_id, field_name, reason_code, created_at FROM validation_events "
                                + "WHERE tenant_id = ? ORDER BY id")) {
            select.setLong(1, tenant.id());
            List<ValidationEvent> events = new ArrayList<>();
            try (ResultSet rows = select.executeQuery()) {
                while (rows.next()) {
                    events.add(new ValidationEvent(
                            rows.getLong("id"),
                            rows.getLong("tenant_id"),
                            rows.getString("field_name"),
                            rows.getString("reason_code"),
                            rows.getObject("created_at", OffsetDateTime.class)));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to read validation events of tenant " + tenant.id(), e);
        }
    }

    /**
     * True when work can be routed for this tenant: onboarding is complete, or a fallback
     * store and key are configured.
     */
    public boolean canRoute(Tenant tenant) {
        return tenant.isOnboarded() || fallback.isEnabled();
    }

    /**
     * Decrypts the tenant's credential for the duration of {@code use}. Tenants without a
     * credential are served by the configured fallback, still writing to their own table.
     *
     * @throws CredentialMissingException when neither a credential nor a fallback exists
     * @throws DecryptionFailedException when stored ciphertext cannot be decrypted
     */
    public <T> T withDecrypted(Tenant tenant, CredentialUse<T> use) {
        Optional<Credential> stored = credential(tenant);
        DecryptedCredential decrypted;
        if (stored.isPresent()) {
            Credential credential = stored.get();
            decrypted = new DecryptedCredential(
                    tenant.id(),
                    credential.store(),
                    cipher.decrypt(credential.storePasswordCiphertext()),
                    cipher.decrypt(credential.providerKeyCiphertext()),
                    credential.tableName(),
                    false);
        } else if (fallback.isEnabled()) {
            decrypted = new DecryptedCredential(
                    tenant.id(),
                    new StoreParams(fallback.getStoreHost(), fallback.getStorePort(),
                            fallback.getStoreDatabase(), fallback.getStoreUser()),
                    fallback.getStorePassword(),
                    fallback.getProviderApiKey(),
                    TableNames.forTenant(tenant.id()),
                    true);
        } else {
            throw new CredentialMissingException("Tenant " + tenant.id() + " has no credential");
        }
        return use.apply(decrypted);
    }

    private Tenant replaceCredential(Tenant tenant, CredentialBundle bundle) {
        OffsetDateTime now = now();
        String passwordCiphertext = cipher.encrypt(bundle.storePassword());
        String keyCiphertext = cipher.encrypt(bundle.providerApiKey());
        String phone = bundle.phone() == null ? tenant.phone() : bundle.phone();
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                try (PreparedStatement update = connection.prepareStatement(
                        "UPDATE tenants SET phone = ?, onboarding_state = ?, updated_at = ? WHERE id = ?")) {
                    update.setString(1, phone);
                    update.setString(2, OnboardingState.COMPLETE.name());
                    update.setObject(3, now);
                    update.setLong(4, tenant.id());
                    if (update.executeUpdate() == 0) {
                        throw new TenantNotFoundException("No tenant with id " + tenant.id());
                    }
                }
                deleteCredential(connection, tenant.id());
                try (PreparedStatement insert = connection.prepareStatement(
                        "INSERT INTO credentials (tenant_id, store_host, store_port, store_database, store_user, "
                                + "store_password_ciphertext, provider_key_ciphertext, provider_key_fingerprint, "
                                + "table_name, last_validated_at, created_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    insert.setLong(1, tenant.id());
                    insert.setString(2, bundle.store().host());
                    insert.setInt(3, bundle.store().port());
                    insert.setString(4, bundle.store().database());
                    insert.setString(5, bundle.store().user());
                    insert.setString(6, passwordCiphertext);
                    insert.setString(7, keyCiphertext);
                    insert.setString(8, ApiKeys.fingerprint(bundle.providerApiKey()));
                    insert.setString(9, TableNames.forTenant(tenant.id()));
                    insert.setObject(10, now);
                    insert.setObject(11, now);
                    insert.executeUpdate();
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to store credential of tenant " + tenant.id(), e);
        }
        return new Tenant(tenant.id(), tenant.chatId(), tenant.username(), tenant.displayName(), phone,
                OnboardingState.COMPLETE, tenant.createdAt(), now);
    }

    private void notifyReplaced(Tenant tenant) {
        for (CredentialListener listener : listeners) {
            listener.credentialReplaced(tenant);
        }
    }

    private static void deleteCredential(Connection connection, long tenantId) throws SQLException {
        try (PreparedStatement delete = connection.prepareStatement("DELETE FROM credentials WHERE tenant_id = ?")) {
            delete.setLong(1, tenantId);
            delete.executeUpdate();
        }
    }

    private Tenant refreshMetadata(Connection connection, Tenant tenant, String username, String displayName)
            throws SQLException {
        boolean usernameChanged = username != null && !username.equals(tenant.username());
        boolean displayNameChanged = displayName != null && !displayName.equals(tenant.displayName());
        if (!usernameChanged && !displayNameChanged) {
            return tenant;
        }
        String newUsername = usernameChanged ? username : tenant.username();
        String newDisplayName = displayNameChanged ? displayName : tenant.displayName();
        OffsetDateTime now = now();
        try (PreparedStatement update = connection.prepareStatement(
                "UPDATE tenants SET username = ?, display_name = ?, updated_at = ? WHERE id = ?")) {
            update.setString(1, newUsername);
            update.setString(2, newDisplayName);
            update.setObject(3, now);
            update.setLong(4, tenant.id());
            update.executeUpdate();
        }
        return new Tenant(tenant.id(), tenant.chatId(), newUsername, newDisplayName, tenant.phone(),
                tenant.onboardingState(), tenant.createdAt(), now);
    }

    private Optional<Tenant> findByChatId(Connection connection, long chatId) throws SQLException {
        try (PreparedStatement select = connection.prepareStatement(
                "SELECT " + TENANT_COLUMNS + " FROM tenants WHERE chat_id = ?")) {
            select.setLong(1, chatId);
            try (ResultSet rows = select.executeQuery()) {
                return rows.next() ? Optional.of(mapTenant(rows)) : Optional.empty();
            }
        }
    }

    private static Tenant mapTenant(ResultSet rows) throws SQLException {
        return new Tenant(
                rows.getLong("id"),
                rows.getLong("chat_id"),
                rows.getString("username"),
                rows.getString("display_name"),
                rows.getString("phone"),
                OnboardingState.valueOf(rows.getString("onboarding_state")),
                rows.getObject("created_at", OffsetDateTime.class),
                rows.getObject("updated_at", OffsetDateTime.class));
    }

    private static Credential mapCredential(ResultSet rows) throws SQLException {
        return new Credential(
                rows.getLong("id"),
                rows.getLong("tenant_id"),
                new StoreParams(
                        rows.getString("store_host"),
                        rows.getInt("store_port"),
                        rows.getString("store_database"),
                        rows.getString("store_user")),
                rows.getString("store_password_ciphertext"),
                rows.getString("provider_key_ciphertext"),
                rows.getString("provider_key_fingerprint"),
                rows.getString("table_name"),
                rows.getObject("last_validated_at", OffsetDateTime.class),
                rows.getObject("created_at", OffsetDateTime.class));
    }

    private static String shortFingerprint(String apiKey) {
        return ApiKeys.fingerprint(apiKey).substring(0, 12);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
