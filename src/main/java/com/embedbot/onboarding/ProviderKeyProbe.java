package com.embedbot.onboarding;

/**
 * Checks an embedding provider key with a minimal request.
 */
public interface ProviderKeyProbe {

    /**
     * @throws ValidationException when the key is rejected, rate limited, or the provider is unavailable
     */
    void probe(String apiKey);
}
