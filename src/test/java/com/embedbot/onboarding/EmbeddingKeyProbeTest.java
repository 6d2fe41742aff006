package com.embedbot.onboarding;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.embedbot.embedding.EmbeddingSettings;
import com.embedbot.embedding.FakeEmbeddingProvider;
import com.embedbot.embedding.ProviderFailure;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EmbeddingKeyProbeTest {
    private static final String KEY = "sk-probe-0123456789abcdef";

    @Test
    void shouldSendSingleProbeInput() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4);

        assertDoesNotThrow(() -> new EmbeddingKeyProbe(provider, settings(4)).probe(KEY));

        assertEquals(List.of(EmbeddingKeyProbe.PROBE_INPUT), provider.requests().get(0).inputs());
        assertEquals(KEY, provider.keys().get(0));
    }

    @Test
    void shouldMapAuthenticationFailureToInvalidKey() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4).failAlways(ProviderFailure.AUTHENTICATION, 1);

        ValidationException error = assertThrows(ValidationException.class,
                () -> new EmbeddingKeyProbe(provider, settings(4)).probe(KEY));

        assertInstanceOf(InvalidKeyException.class, error);
    }

    @Test
    void shouldMapRateLimitWithoutRetrying() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4).failAlways(ProviderFailure.RATE_LIMITED, 3);

        ValidationException error = assertThrows(ValidationException.class,
                () -> new EmbeddingKeyProbe(provider, settings(4)).probe(KEY));

        assertEquals(ValidationReason.RATE_LIMITED, error.reason());
        assertEquals(1, provider.requests().size());
    }

    @Test
    void shouldMapServerErrorToProviderUnavailable() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4).failAlways(ProviderFailure.SERVER_ERROR, 1);

        ValidationException error = assertThrows(ValidationException.class,
                () -> new EmbeddingKeyProbe(provider, settings(4)).probe(KEY));

        assertEquals(ValidationReason.PROVIDER_UNAVAILABLE, error.reason());
    }

    @Test
    void shouldRejectVectorsOfUnexpectedSize() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> new EmbeddingKeyProbe(new FakeEmbeddingProvider(8), settings(4)).probe(KEY));

        assertEquals(ValidationReason.DIMENSION_MISMATCH, error.reason());
    }

    private static EmbeddingSettings settings(int dimensions) {
        return new EmbeddingSettings("test-model", dimensions, 10, 3, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
}
