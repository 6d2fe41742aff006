package com.embedbot.onboarding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.tenant.Credential;
import com.embedbot.tenant.CredentialBundle;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.OnboardingState;
import com.embedbot.tenant.Tenant;
import com.embedbot.vectorstore.SchemaException;
import com.embedbot.vectorstore.VectorStoreRouter;

/**
 * Drives the onboarding state machine for every tenant. Answers are kept in memory per
 * tenant until validation succeeds; the persisted tenant state follows each transition,
 * except during key rotation where the tenant stays {@link OnboardingState#COMPLETE}.
 */
public class OnboardingValidator {
    private static final Logger log = LoggerFactory.getLogger(OnboardingValidator.class);

    static final String WELCOME = "This bot embeds your documents into your own vector database. "
            + "A short setup collects the connection details; send /cancel at any time to stop.";
    static final String ALREADY_COMPLETE = "Setup is already complete. You can upload documents.";
    static final String SUCCESS = "Done! The connection is verified and saved. You can upload documents now.";
    static final String ROTATION_SUCCESS = "The new key is verified and saved.";
    static final String CANCELLED = "Setup cancelled. Send /start to begin again.";
    static final String ROTATION_CANCELLED = "Key rotation cancelled. The previous credentials stay active.";

    private final JdbcTenantRegistry registry;
    private final VectorStoreRouter router;
    private final StoreProbe storeProbe;
    private final ProviderKeyProbe keyProbe;
    private final Map<Long, OnboardingSession> sessions = new ConcurrentHashMap<>();

    public OnboardingValidator(JdbcTenantRegistry registry,
            VectorStoreRouter router,
            StoreProbe storeProbe,
            ProviderKeyProbe keyProbe) {
        this.registry = registry;
        this.router = router;
        this.storeProbe = storeProbe;
        this.keyProbe = keyProbe;
    }

    public boolean isActive(Tenant tenant) {
        return sessions.containsKey(tenant.id());
    }

    public Optional<OnboardingState> sessionState(Tenant tenant) {
        OnboardingSession session = sessions.get(tenant.id());
        return session == null ? Optional.empty() : Optional.of(session.state());
    }

    /**
     * Begins onboarding unless the tenant already completed it. An unfinished session is
     * resumed at its pending question.
     */
    public OnboardingReply start(Tenant tenant) {
        if (tenant.isOnboarded()) {
            return OnboardingReply.of(OnboardingState.COMPLETE, ALREADY_COMPLETE);
        }
        OnboardingSession existing = sessions.get(tenant.id());
        if (existing != null) {
            return new OnboardingReply(existing.state(), List.of(prompt(existing)));
        }
        return restart(tenant);
    }

    /**
     * Discards any answers and starts again from the identity question.
     */
    public OnboardingReply restart(Tenant tenant) {
        OnboardingSession session = new OnboardingSession(tenant, tenant.onboardingState(), false);
        session.apply(OnboardingOutcome.RESTARTED);
        session.tenant(registry.updateState(tenant, session.state()));
        sessions.put(tenant.id(), session);
        log.info("onboarding.started tenantId={}", tenant.id());
        return OnboardingReply.of(session.state(), WELCOME, prompt(session));
    }

    /**
     * Starts a key rotation: the current store answers are loaded from the stored credential,
     * only a new provider key is asked for, and everything is validated again.
     */
    public OnboardingReply startRotation(Tenant tenant) {
        if (!tenant.isOnboarded()) {
            return OnboardingReply.of(tenant.onboardingState(),
                    "Finish setup before rotating keys. Send /start to continue.");
        }
        OnboardingSession session = new OnboardingSession(tenant, OnboardingState.COMPLETE, true);
        registry.withDecrypted(tenant, credential -> {
            session.answer(OnboardingField.PHONE, tenant.phone());
            session.answer(OnboardingField.STORE_HOST, credential.store().host());
            session.answer(OnboardingField.STORE_PORT, Integer.toString(credential.store().port()));
            session.answer(OnboardingField.STORE_DATABASE, credential.store().database());
            session.answer(OnboardingField.STORE_USER, credential.store().user());
            session.answer(OnboardingField.STORE_PASSWORD, credential.storePassword());
            return null;
        });
        session.apply(OnboardingOutcome.ROTATION_STARTED);
        sessions.put(tenant.id(), session);
        log.info("onboarding.rotation.started tenantId={}", tenant.id());
        return OnboardingReply.of(session.state(), prompt(session));
    }

    /**
     * Feeds one answer into the tenant's session. Invalid answers are re-requested without
     * advancing.
     */
    public OnboardingReply accept(Tenant tenant, String input) {
        OnboardingSession session = sessions.get(tenant.id());
        if (session == null) {
            return start(tenant);
        }
        Optional<OnboardingField> pending = session.pendingField();
        if (pending.isEmpty()) {
            return advance(session, new ArrayList<>());
        }
        OnboardingField field = pending.get();
        String value;
        try {
            value = FieldRules.normalize(field, input);
        } catch (ValidationException e) {
            log.debug("onboarding.answer.rejected tenantId={} field={}", tenant.id(), field);
            return OnboardingReply.of(session.state(), e.getMessage(), field.prompt());
        }
        session.answer(field, value);
        log.debug("onboarding.answer.accepted tenantId={} field={}", tenant.id(), field);
        return advance(session, new ArrayList<>());
    }

    public OnboardingReply cancel(Tenant tenant) {
        OnboardingSession session = sessions.remove(tenant.id());
        if (session == null) {
            return OnboardingReply.of(tenant.onboardingState(), "Nothing to cancel.");
        }
        session.clear();
        if (session.isRotation()) {
            log.info("onboarding.rotation.cancelled tenantId={}", tenant.id());
            return OnboardingReply.of(OnboardingState.COMPLETE, ROTATION_CANCELLED);
        }
        OnboardingState state = session.apply(OnboardingOutcome.CANCELLED);
        registry.updateState(session.tenant(), state);
        log.info("onboarding.abandoned tenantId={}", tenant.id());
        return OnboardingReply.of(state, CANCELLED);
    }

    private OnboardingReply advance(OnboardingSession session, List<String> messages) {
        while (session.pendingField().isEmpty() && session.state().isCollecting()) {
            transition(session, OnboardingOutcome.STEP_COMPLETE);
        }
        if (session.state() == OnboardingState.VALIDATING) {
            return validate(session, messages);
        }
        messages.add(prompt(session));
        return new OnboardingReply(session.state(), messages);
    }

    private OnboardingReply validate(OnboardingSession session, List<String> messages) {
        messages.add("Checking the connection...");
        CredentialBundle bundle;
        try {
            bundle = session.bundle();
            storeProbe.probe(bundle.store(), bundle.storePassword());
            keyProbe.probe(bundle.providerApiKey());
        } catch (ValidationException e) {
            return reject(session, e, messages);
        }

        Tenant tenant = session.tenant();
        Optional<Credential> previous = registry.credential(tenant);
        Tenant saved = session.isRotation()
                ? registry.rotateKey(tenant, bundle)
                : registry.upsertCredential(tenant, bundle);
        session.tenant(saved);
        session.apply(OnboardingOutcome.VALIDATED);
        try {
            router.ensureSchema(saved);
        } catch (SchemaException e) {
            log.warn("onboarding.provisioning.failed tenantId={} error={}", saved.id(), e.getMessage());
            revertCredential(saved, previous);
            registry.recordValidationFailure(saved, OnboardingField.STORE_DATABASE.name(),
                    ValidationReason.PROVISIONING_FAILED.name());
            session.clearAnswersOf(OnboardingState.COLLECTING_STORE_PARAMS);
            transition(session, OnboardingOutcome.PROVISIONING_FAILED);
            messages.add("The connection works, but the segment table could not be created. "
                    + "Check that the user may create tables, then enter the database details again.");
            messages.add(prompt(session));
            return new OnboardingReply(session.state(), messages);
        }
        sessions.remove(saved.id());
        session.clear();
        log.info("onboarding.complete tenantId={} rotation={}", saved.id(), session.isRotation());
        messages.add(session.isRotation() ? ROTATION_SUCCESS : SUCCESS);
        return new OnboardingReply(OnboardingState.COMPLETE, messages);
    }

    private void revertCredential(Tenant tenant, Optional<Credential> previous) {
        if (previous.isPresent()) {
            registry.restoreCredential(tenant, previous.get());
        } else {
            registry.removeCredential(tenant);
        }
    }

    private OnboardingReply reject(OnboardingSession session, ValidationException e, List<String> messages) {
        OnboardingField field = e.field();
        registry.recordValidationFailure(session.tenant(), field.name(), e.reason().name());
        session.clearAnswersOf(field.owner());
        transition(session, OnboardingOutcome.rejectedBy(field));
        messages.add("Validation failed: " + e.getMessage());
        messages.add(prompt(session));
        return new OnboardingReply(session.state(), messages);
    }

    private void transition(OnboardingSession session, OnboardingOutcome outcome) {
        OnboardingState from = session.state();
        OnboardingState to = session.apply(outcome);
        if (!session.isRotation()) {
            session.tenant(registry.updateState(session.tenant(), to));
        }
        log.debug("onboarding.transition tenantId={} from={} outcome={} to={}", session.tenant().id(), from,
                outcome, to);
    }

    private static String prompt(OnboardingSession session) {
        return session.pendingField().map(OnboardingField::prompt).orElse("Send any message to continue.");
    }
}
