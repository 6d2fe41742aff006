package com.embedbot.onboarding;

import java.util.List;

import com.embedbot.tenant.OnboardingState;

/**
 * Messages to send back to the tenant and the state the session ended in.
 */
public record OnboardingReply(OnboardingState state, List<String> messages) {

    public OnboardingReply {
        messages = List.copyOf(messages);
    }

    static OnboardingReply of(OnboardingState state, String... messages) {
        return new OnboardingReply(state, List.of(messages));
    }

    public boolean isComplete() {
        return state == OnboardingState.COMPLETE;
    }
}
