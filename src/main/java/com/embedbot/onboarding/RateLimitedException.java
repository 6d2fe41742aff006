package com.embedbot.onboarding;

public class RateLimitedException extends ValidationException {

    public RateLimitedException(String message, Throwable cause) {
        super(OnboardingField.PROVIDER_API_KEY, ValidationReason.RATE_LIMITED, message, cause);
    }
}
