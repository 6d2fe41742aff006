package com.embedbot.onboarding;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.H2Databases;
import com.embedbot.tenant.DecryptedCredential;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.OnboardingState;
import com.embedbot.tenant.StoreParams;
import com.embedbot.tenant.Tenant;
import com.embedbot.tenant.TestCiphers;
import com.embedbot.tenant.ValidationEvent;
import com.embedbot.vectorstore.H2VectorStoreDialect;
import com.embedbot.vectorstore.HikariTenantDataSourceFactory;
import com.embedbot.vectorstore.SegmentRecord;
import com.embedbot.vectorstore.TestStores;
import com.embedbot.vectorstore.VectorStoreDialect;
import com.embedbot.vectorstore.VectorStoreRouter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OnboardingValidatorTest {
    private static final String KEY = "sk-test-0123456789abcdefgh";

    private JdbcTenantRegistry registry;
    private VectorStoreRouter router;
    private final List<StoreParams> probedStores = new ArrayList<>();
    private final List<String> probedKeys = new ArrayList<>();
    private final List<ValidationException> storeFailures = new ArrayList<>();
    private final List<ValidationException> keyFailures = new ArrayList<>();
    private StoreParams store;

    @BeforeEach
    void setUp() {
        registry = new JdbcTenantRegistry(H2Databases.controlDatabase(), TestCiphers.aes(),
                new AppConfig.FallbackConfig());
        store = TestStores.newStore();
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.close();
        }
    }

    @Test
    void shouldCompleteOnboardingAndProvisionTable() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");

        OnboardingReply first = validator.start(tenant);
        OnboardingReply last = answerAll(validator, tenant);

        assertEquals(OnboardingState.COLLECTING_IDENTITY, first.state());
        assertEquals(OnboardingValidator.WELCOME, first.messages().get(0));
        assertTrue(last.isComplete());
        assertTrue(last.messages().contains(OnboardingValidator.SUCCESS));
        assertFalse(validator.isActive(tenant));
        Tenant saved = registry.require(1L);
        assertEquals(OnboardingState.COMPLETE, saved.onboardingState());
        assertEquals("+14155550123", saved.phone());
        assertEquals(List.of(KEY), probedKeys);
        assertEquals(FieldRules.DEFAULT_PORT, probedStores.get(0).port());
        assertEquals(0, router.count(saved, 1L));
    }

    @Test
    void shouldRepeatQuestionWithoutAdvancingOnInvalidAnswer() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);

        OnboardingReply reply = validator.accept(tenant, "call me maybe");

        assertEquals(OnboardingState.COLLECTING_IDENTITY, reply.state());
        assertEquals(OnboardingField.PHONE.prompt(), reply.messages().get(1));
        assertTrue(registry.validationEvents(tenant).isEmpty());
    }

    @Test
    void shouldReturnToStoreQuestionsWhenHostIsUnreachableAndKeepTheKey() {
        storeFailures.add(new ValidationException(OnboardingField.STORE_HOST, ValidationReason.UNREACHABLE,
                "Unable to connect to the database server."));
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);

        OnboardingReply rejected = answerAll(validator, tenant);

        assertEquals(OnboardingState.COLLECTING_STORE_PARAMS, rejected.state());
        assertEquals(OnboardingField.STORE_HOST.prompt(), rejected.messages().get(rejected.messages().size() - 1));
        assertEquals(OnboardingState.COLLECTING_STORE_PARAMS, registry.require(1L).onboardingState());
        List<ValidationEvent> events = registry.validationEvents(tenant);
        assertEquals(1, events.size());
        assertEquals("STORE_HOST", events.get(0).fieldName());
        assertEquals("UNREACHABLE", events.get(0).reasonCode());

        OnboardingReply done = answerStore(validator, tenant);

        assertTrue(done.isComplete());
        assertEquals(1, probedKeys.size());
        assertEquals(2, probedStores.size());
    }

    @Test
    void shouldAskForKeyAgainWhenProviderRejectsIt() {
        keyFailures.add(new InvalidKeyException("The embedding provider rejected the API key.", null));
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);

        OnboardingReply rejected = answerAll(validator, tenant);
        OnboardingReply done = validator.accept(tenant, "sk-second-0123456789abcdef");

        assertEquals(OnboardingState.COLLECTING_PROVIDER_KEY, rejected.state());
        assertTrue(done.isComplete());
        assertEquals("INVALID_KEY", registry.validationEvents(tenant).get(0).reasonCode());
        assertEquals("sk-second-0123456789abcdef",
                registry.withDecrypted(registry.require(1L), DecryptedCredential::providerApiKey));
    }

    @Test
    void shouldReturnToStoreQuestionsWhenTableCannotBeCreated() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.failingProvisioning());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);

        OnboardingReply reply = answerAll(validator, tenant);

        assertEquals(OnboardingState.COLLECTING_STORE_PARAMS, reply.state());
        assertTrue(validator.isActive(tenant));
        ValidationEvent event = registry.validationEvents(tenant).get(0);
        assertEquals("STORE_DATABASE", event.fieldName());
        assertEquals("PROVISIONING_FAILED", event.reasonCode());
    }

    @Test
    void shouldLeaveNoCredentialWhenFirstProvisioningFails() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.failingProvisioning());
        registry.addListener(router);
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);
        answerAll(validator, tenant);

        assertTrue(registry.credential(tenant).isEmpty());

        OnboardingReply cancelled = validator.cancel(tenant);

        assertEquals(OnboardingState.ABANDONED, cancelled.state());
        assertTrue(registry.credential(tenant).isEmpty());
        assertFalse(registry.canRoute(registry.require(1L)));
    }

    @Test
    void shouldKeepPreviousKeyWhenRotationProvisioningFails() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.failingProvisioning());
        registry.addListener(router);
        Tenant complete = TestStores.onboard(registry, 1L);
        String previousKey = registry.withDecrypted(complete, DecryptedCredential::providerApiKey);
        validator.startRotation(complete);

        OnboardingReply failed = validator.accept(complete, "sk-new-0123456789abcdefgh");

        assertEquals(OnboardingState.COLLECTING_STORE_PARAMS, failed.state());
        assertEquals(previousKey, registry.withDecrypted(complete, DecryptedCredential::providerApiKey));

        OnboardingReply cancelled = validator.cancel(complete);

        assertEquals(List.of(OnboardingValidator.ROTATION_CANCELLED), cancelled.messages());
        assertEquals(previousKey, registry.withDecrypted(complete, DecryptedCredential::providerApiKey));
        assertEquals(OnboardingState.COMPLETE, registry.require(1L).onboardingState());
    }

    @Test
    void shouldRouteToNewStoreAfterSetupIsRepeated() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        registry.addListener(router);
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);
        answerAll(validator, tenant);
        Tenant first = registry.require(1L);
        router.write(first, 7L, List.of(new SegmentRecord(0, SegmentRecord.title("a.txt", 7L, 0), "Old store body.",
                new float[] {1f, 2f, 3f})));
        assertEquals(1, router.count(first, 7L));

        store = TestStores.newStore();
        validator.restart(first);
        OnboardingReply done = answerAll(validator, first);

        assertTrue(done.isComplete());
        Tenant second = registry.require(1L);
        assertEquals(store, registry.credential(second).orElseThrow().store());
        assertEquals(0, router.count(second, 7L));
    }

    @Test
    void shouldAbandonOnCancel() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);
        validator.accept(tenant, "+14155550123");

        OnboardingReply reply = validator.cancel(tenant);

        assertEquals(OnboardingState.ABANDONED, reply.state());
        assertEquals(OnboardingState.ABANDONED, registry.require(1L).onboardingState());
        assertFalse(validator.isActive(tenant));
    }

    @Test
    void shouldRotateKeyWhileTenantStaysComplete() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        registry.addListener(router);
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);
        answerAll(validator, tenant);
        Tenant complete = registry.require(1L);

        OnboardingReply prompt = validator.startRotation(complete);
        assertEquals(OnboardingState.COLLECTING_PROVIDER_KEY, prompt.state());
        assertEquals(OnboardingState.COMPLETE, registry.require(1L).onboardingState());

        OnboardingReply done = validator.accept(complete, "sk-rotated-0123456789abcdef");

        assertTrue(done.messages().contains(OnboardingValidator.ROTATION_SUCCESS));
        assertEquals("sk-rotated-0123456789abcdef",
                registry.withDecrypted(complete, DecryptedCredential::providerApiKey));
        assertEquals(store, probedStores.get(1));
    }

    @Test
    void shouldReportAlreadyCompleteOnStart() {
        OnboardingValidator validator = validator(H2VectorStoreDialect.standard());
        Tenant tenant = registry.getOrCreate(1L, "alice", "Alice");
        validator.start(tenant);
        answerAll(validator, tenant);

        OnboardingReply reply = validator.start(registry.require(1L));

        assertEquals(List.of(OnboardingValidator.ALREADY_COMPLETE), reply.messages());
    }

    private OnboardingValidator validator(VectorStoreDialect dialect) {
        router = new VectorStoreRouter(registry, dialect, new HikariTenantDataSourceFactory(dialect, 2), 3);
        StoreProbe storeProbe = (params, password) -> {
            probedStores.add(params);
            if (!storeFailures.isEmpty()) {
                throw storeFailures.remove(0);
            }
        };
        ProviderKeyProbe keyProbe = apiKey -> {
            probedKeys.add(apiKey);
            if (!keyFailures.isEmpty()) {
                throw keyFailures.remove(0);
            }
        };
        return new OnboardingValidator(registry, router, storeProbe, keyProbe);
    }

    private OnboardingReply answerAll(OnboardingValidator validator, Tenant tenant) {
        validator.accept(tenant, "+1 (415) 555-0123");
        answerStore(validator, tenant);
        return validator.accept(tenant, KEY);
    }

    private OnboardingReply answerStore(OnboardingValidator validator, Tenant tenant) {
        validator.accept(tenant, store.host());
        validator.accept(tenant, "-");
        validator.accept(tenant, store.database());
        validator.accept(tenant, store.user());
        return validator.accept(tenant, TestStores.STORE_PASSWORD);
    }
}
