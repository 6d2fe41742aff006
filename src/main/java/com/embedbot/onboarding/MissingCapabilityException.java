package com.embedbot.onboarding;

public class MissingCapabilityException extends ValidationException {

    public MissingCapabilityException(String message) {
        super(OnboardingField.STORE_DATABASE, ValidationReason.MISSING_CAPABILITY, message);
    }
}
