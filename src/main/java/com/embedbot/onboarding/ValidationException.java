package com.embedbot.onboarding;

/**
 * A rejected onboarding answer or failed probe. The message is shown to the tenant and must
 * not contain secret values.
 */
public class ValidationException extends RuntimeException {
    private final OnboardingField field;
    private final ValidationReason reason;

    public ValidationException(OnboardingField field, ValidationReason reason, String message) {
        this(field, reason, message, null);
    }

    public ValidationException(OnboardingField field, ValidationReason reason, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.reason = reason;
    }

    public OnboardingField field() {
        return field;
    }

    public ValidationReason reason() {
        return reason;
    }
}
