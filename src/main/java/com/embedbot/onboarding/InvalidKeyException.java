package com.embedbot.onboarding;

public class InvalidKeyException extends ValidationException {

    public InvalidKeyException(String message, Throwable cause) {
        super(OnboardingField.PROVIDER_API_KEY, ValidationReason.INVALID_KEY, message, cause);
    }
}
