package com.embedbot.onboarding;

public enum OnboardingOutcome {
    STEP_COMPLETE,
    IDENTITY_REJECTED,
    STORE_REJECTED,
    KEY_REJECTED,
    VALIDATED,
    PROVISIONING_FAILED,
    ROTATION_STARTED,
    RESTARTED,
    CANCELLED;

    static OnboardingOutcome rejectedBy(OnboardingField field) {
        return switch (field.owner()) {
            case COLLECTING_IDENTITY -> IDENTITY_REJECTED;
            case COLLECTING_STORE_PARAMS -> STORE_REJECTED;
            case COLLECTING_PROVIDER_KEY -> KEY_REJECTED;
            default -> throw new IllegalArgumentException("Field " + field + " has no collecting owner");
        };
    }
}
