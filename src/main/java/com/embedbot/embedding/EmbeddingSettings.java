package com.embedbot.embedding;

import java.time.Duration;

import com.embedbot.runtime.AppConfig;

/**
 * Batching, retry and pacing policy for {@link EmbeddingClient}.
 */
public record EmbeddingSettings(
        String model,
        int dimensions,
        int batchSize,
        int maxAttempts,
        Duration retryBaseDelay,
        Duration retryMaxDelay,
        Duration requestDelay) {

    public EmbeddingSettings {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("embedding model must not be blank");
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("embedding dimensions must be > 0");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("embedding batchSize must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("embedding maxAttempts must be > 0");
        }
        if (retryBaseDelay.isNegative() || retryMaxDelay.isNegative() || requestDelay.isNegative()) {
            throw new IllegalArgumentException("embedding delays must be >= 0");
        }
    }

    public static EmbeddingSettings from(AppConfig.EmbeddingConfig config) {
        return new EmbeddingSettings(
                config.getModel(),
                config.getDimensions(),
                config.getBatchSize(),
                config.getMaxAttempts(),
                Duration.ofMillis(config.getRetryBaseDelayMs()),
                Duration.ofMillis(config.getRetryMaxDelayMs()),
                Duration.ofMillis(config.getRequestDelayMs()));
    }
}
