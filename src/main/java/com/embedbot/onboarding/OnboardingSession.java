package com.embedbot.onboarding;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.embedbot.tenant.CredentialBundle;
import com.embedbot.tenant.OnboardingState;
import com.embedbot.tenant.StoreParams;
import com.embedbot.tenant.Tenant;

/**
 * In-memory answers of one tenant's onboarding or key rotation. Secret answers never leave
 * this object except inside the {@link CredentialBundle} handed to validation.
 */
final class OnboardingSession {
    private Tenant tenant;
    private OnboardingState state;
    private final boolean rotation;
    private final Map<OnboardingField, String> answers = new EnumMap<>(OnboardingField.class);

    OnboardingSession(Tenant tenant, OnboardingState state, boolean rotation) {
        this.tenant = tenant;
        this.state = state;
        this.rotation = rotation;
    }

    Tenant tenant() {
        return tenant;
    }

    void tenant(Tenant tenant) {
        this.tenant = tenant;
    }

    OnboardingState state() {
        return state;
    }

    boolean isRotation() {
        return rotation;
    }

    OnboardingState apply(OnboardingOutcome outcome) {
        state = OnboardingTransitions.next(state, outcome);
        return state;
    }

    void answer(OnboardingField field, String value) {
        answers.put(field, value);
    }

    boolean hasAnswer(OnboardingField field) {
        return answers.containsKey(field);
    }

    /**
     * The first field of the current state that still needs an answer.
     */
    Optional<OnboardingField> pendingField() {
        for (OnboardingField field : OnboardingField.ownedBy(state)) {
            if (!answers.containsKey(field)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    void clearAnswersOf(OnboardingState owner) {
        for (OnboardingField field : OnboardingField.ownedBy(owner)) {
            answers.remove(field);
        }
    }

    void clear() {
        answers.clear();
    }

    /**
     * Re-checks every answer and assembles the bundle.
     *
     * @throws ValidationException for the first answer that is missing or malformed
     */
    CredentialBundle bundle() {
        for (OnboardingField field : OnboardingField.values()) {
            if (!answers.containsKey(field)) {
                throw new ValidationException(field, ValidationReason.INVALID_FORMAT, "Missing answer.");
            }
            FieldRules.normalize(field, answers.get(field));
        }
        StoreParams store = new StoreParams(
                answers.get(OnboardingField.STORE_HOST),
                Integer.parseInt(answers.get(OnboardingField.STORE_PORT)),
                answers.get(OnboardingField.STORE_DATABASE),
                answers.get(OnboardingField.STORE_USER));
        return new CredentialBundle(
                answers.get(OnboardingField.PHONE),
                store,
                answers.get(OnboardingField.STORE_PASSWORD),
                answers.get(OnboardingField.PROVIDER_API_KEY));
    }
}
