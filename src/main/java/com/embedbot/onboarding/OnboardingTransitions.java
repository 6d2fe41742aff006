package com.embedbot.onboarding;

import static com.embedbot.tenant.OnboardingState.ABANDONED;
import static com.embedbot.tenant.OnboardingState.COLLECTING_IDENTITY;
import static com.embedbot.tenant.OnboardingState.COLLECTING_PROVIDER_KEY;
import static com.embedbot.tenant.OnboardingState.COLLECTING_STORE_PARAMS;
import static com.embedbot.tenant.OnboardingState.COMPLETE;
import static com.embedbot.tenant.OnboardingState.VALIDATING;

import java.util.EnumMap;
import java.util.Map;

import com.embedbot.tenant.OnboardingState;

/**
 * The onboarding transition table. A (state, outcome) pair missing from the table is a
 * programming error.
 */
public final class OnboardingTransitions {
    private static final Map<OnboardingState, Map<OnboardingOutcome, OnboardingState>> TABLE =
            new EnumMap<>(OnboardingState.class);

    static {
        for (OnboardingState state : OnboardingState.values()) {
            TABLE.put(state, new EnumMap<>(OnboardingOutcome.class));
            on(state, OnboardingOutcome.RESTARTED, COLLECTING_IDENTITY);
        }
        on(COLLECTING_IDENTITY, OnboardingOutcome.STEP_COMPLETE, COLLECTING_STORE_PARAMS);
        on(COLLECTING_STORE_PARAMS, OnboardingOutcome.STEP_COMPLETE, COLLECTING_PROVIDER_KEY);
        on(COLLECTING_PROVIDER_KEY, OnboardingOutcome.STEP_COMPLETE, VALIDATING);

        on(VALIDATING, OnboardingOutcome.VALIDATED, COMPLETE);
        on(VALIDATING, OnboardingOutcome.IDENTITY_REJECTED, COLLECTING_IDENTITY);
        on(VALIDATING, OnboardingOutcome.STORE_REJECTED, COLLECTING_STORE_PARAMS);
        on(VALIDATING, OnboardingOutcome.KEY_REJECTED, COLLECTING_PROVIDER_KEY);

        on(COMPLETE, OnboardingOutcome.PROVISIONING_FAILED, COLLECTING_STORE_PARAMS);
        on(COMPLETE, OnboardingOutcome.ROTATION_STARTED, COLLECTING_PROVIDER_KEY);

        for (OnboardingState state : new OnboardingState[] {
                COLLECTING_IDENTITY, COLLECTING_STORE_PARAMS, COLLECTING_PROVIDER_KEY, VALIDATING }) {
            on(state, OnboardingOutcome.CANCELLED, ABANDONED);
        }
    }

    private OnboardingTransitions() {
    }

    public static OnboardingState next(OnboardingState state, OnboardingOutcome outcome) {
        OnboardingState next = TABLE.get(state).get(outcome);
        if (next == null) {
            throw new IllegalStateException("No onboarding transition from " + state + " on " + outcome);
        }
        return next;
    }

    public static boolean allows(OnboardingState state, OnboardingOutcome outcome) {
        return TABLE.get(state).containsKey(outcome);
    }

    private static void on(OnboardingState from, OnboardingOutcome outcome, OnboardingState to) {
        TABLE.get(from).put(outcome, to);
    }
}
