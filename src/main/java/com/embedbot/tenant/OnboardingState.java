package com.embedbot.tenant;

public enum OnboardingState {
    COLLECTING_IDENTITY,
    COLLECTING_STORE_PARAMS,
    COLLECTING_PROVIDER_KEY,
    VALIDATING,
    COMPLETE,
    ABANDONED;

    public boolean isCollecting() {
        return this == COLLECTING_IDENTITY || this == COLLECTING_STORE_PARAMS || this == COLLECTING_PROVIDER_KEY;
    }
}
