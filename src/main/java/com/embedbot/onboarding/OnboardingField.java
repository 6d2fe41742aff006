package com.embedbot.onboarding;

import java.util.ArrayList;
import java.util.List;

import com.embedbot.tenant.OnboardingState;

/**
 * Answers collected during onboarding, in the order they are asked, each owned by one
 * collecting state.
 */
public enum OnboardingField {
    PHONE(OnboardingState.COLLECTING_IDENTITY, false,
            "Send your phone number in international format (example: +14155550123)."),
    STORE_HOST(OnboardingState.COLLECTING_STORE_PARAMS, false,
            "Vector database host (example: db.example.com):"),
    STORE_PORT(OnboardingState.COLLECTING_STORE_PARAMS, false,
            "Vector database port (send \"-\" for the default 5432):"),
    STORE_DATABASE(OnboardingState.COLLECTING_STORE_PARAMS, false,
            "Database name:"),
    STORE_USER(OnboardingState.COLLECTING_STORE_PARAMS, false,
            "Database user:"),
    STORE_PASSWORD(OnboardingState.COLLECTING_STORE_PARAMS, true,
            "Database password (at least 6 characters):"),
    PROVIDER_API_KEY(OnboardingState.COLLECTING_PROVIDER_KEY, true,
            "Embedding provider API key:");

    private final OnboardingState owner;
    private final boolean secret;
    private final String prompt;

    OnboardingField(OnboardingState owner, boolean secret, String prompt) {
        this.owner = owner;
        this.secret = secret;
        this.prompt = prompt;
    }

    public OnboardingState owner() {
        return owner;
    }

    public boolean isSecret() {
        return secret;
    }

    public String prompt() {
        return prompt;
    }

    public static List<OnboardingField> ownedBy(OnboardingState state) {
        List<OnboardingField> fields = new ArrayList<>();
        for (OnboardingField field : values()) {
            if (field.owner == state) {
                fields.add(field);
            }
        }
        return fields;
    }
}
