package com.embedbot.embedding;

public enum ProviderFailure {
    RATE_LIMITED(true),
    TIMEOUT(true),
    CONNECTION(true),
    SERVER_ERROR(true),
    AUTHENTICATION(false),
    REJECTED(false),
    MALFORMED_RESPONSE(false),
    DIMENSION_MISMATCH(false);

    private final boolean transientFailure;

    ProviderFailure(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
