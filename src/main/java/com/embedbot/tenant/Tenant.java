package com.embedbot.tenant;

import java.time.OffsetDateTime;

public record Tenant(
        long id,
        long chatId,
        String username,
        String displayName,
        String phone,
        OnboardingState onboardingState,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public boolean isOnboarded() {
        return onboardingState == OnboardingState.COMPLETE;
    }

    public Tenant withState(OnboardingState state) {
        return new Tenant(id, chatId, username, displayName, phone, state, createdAt, updatedAt);
    }
}
