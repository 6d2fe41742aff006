package com.embedbot.onboarding;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.embedding.EmbeddingProvider;
import com.embedbot.embedding.EmbeddingRequest;
import com.embedbot.embedding.EmbeddingSettings;
import com.embedbot.embedding.ProviderException;

/**
 * Sends a single one-input embedding request, without retries, and checks the vector size.
 */
public class EmbeddingKeyProbe implements ProviderKeyProbe {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingKeyProbe.class);
    static final String PROBE_INPUT = "connectivity-check";

    private final EmbeddingProvider provider;
    private final EmbeddingSettings settings;

    public EmbeddingKeyProbe(EmbeddingProvider provider, EmbeddingSettings settings) {
        this.provider = provider;
        this.settings = settings;
    }

    @Override
    public void probe(String apiKey) {
        List<float[]> vectors;
        try {
            vectors = provider.embed(new EmbeddingRequest(settings.model(), List.of(PROBE_INPUT)), apiKey);
        } catch (ProviderException e) {
            log.warn("onboarding.key.probe.failed failure={} status={}", e.failure(), e.statusCode());
            throw switch (e.failure()) {
                case AUTHENTICATION -> new InvalidKeyException("The embedding provider rejected the API key.", e);
                case RATE_LIMITED -> new RateLimitedException(
                        "The embedding provider is rate limiting this key. Wait a minute and send it again.", e);
                default -> new ValidationException(OnboardingField.PROVIDER_API_KEY,
                        ValidationReason.PROVIDER_UNAVAILABLE,
                        "The embedding provider is unavailable right now. Try again later.", e);
            };
        }
        if (vectors.size() != 1 || vectors.get(0).length != settings.dimensions()) {
            int actual = vectors.isEmpty() ? 0 : vectors.get(0).length;
            throw new ValidationException(OnboardingField.PROVIDER_API_KEY, ValidationReason.DIMENSION_MISMATCH,
                    "The provider returned vectors of size " + actual + " but " + settings.dimensions()
                            + " are configured.");
        }
        log.info("onboarding.key.probe.ok model={}", settings.model());
    }
}
