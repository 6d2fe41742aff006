package com.embedbot.onboarding;

/**
 * Reason codes stored with failed validation attempts. Codes never carry remote error text.
 */
public enum ValidationReason {
    INVALID_FORMAT,
    UNREACHABLE,
    STORE_AUTH_FAILED,
    UNKNOWN_DATABASE,
    MISSING_CAPABILITY,
    INVALID_KEY,
    RATE_LIMITED,
    PROVIDER_UNAVAILABLE,
    DIMENSION_MISMATCH,
    PROVISIONING_FAILED
}
