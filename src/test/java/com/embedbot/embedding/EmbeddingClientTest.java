package com.embedbot.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingClientTest {
    private static final String KEY = "sk-test-0123456789abcdef";

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    void shouldReturnOneVectorPerSegmentInOrderAcrossBatches() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4);
        EmbeddingClient client = client(provider, settings(2, 3, Duration.ZERO));
        List<String> segments = List.of("alpha one", "beta two", "gamma three", "delta four", "epsilon five");

        List<float[]> vectors = client.embed(KEY, segments);

        assertEquals(5, vectors.size());
        for (int i = 0; i < segments.size(); i++) {
            assertArrayEquals(FakeEmbeddingProvider.vectorFor(segments.get(i), 4), vectors.get(i));
        }
        assertEquals(3, provider.requests().size());
        assertEquals(List.of("epsilon five"), provider.requests().get(2).inputs());
    }

    @Test
    void shouldReturnEmptyListWithoutCallingProvider() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4);

        assertTrue(client(provider, settings(2, 3, Duration.ZERO)).embed(KEY, List.of()).isEmpty());
        assertTrue(provider.requests().isEmpty());
    }

    @Test
    void shouldRetryTransientFailuresAndThenSucceed() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4)
                .failAlways(ProviderFailure.RATE_LIMITED, 2);
        EmbeddingClient client = client(provider, settings(10, 3, Duration.ZERO));

        List<float[]> vectors = client.embed(KEY, List.of("one segment here"));

        assertEquals(1, vectors.size());
        assertEquals(3, provider.requests().size());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldStopAfterMaxAttemptsOfTransientFailures() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4)
                .failAlways(ProviderFailure.SERVER_ERROR, 10);
        EmbeddingClient client = client(provider, settings(10, 3, Duration.ZERO));

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> client.embed(KEY, List.of("one segment here")));

        assertEquals(3, provider.requests().size());
        assertEquals(3, error.attempts());
        assertEquals(0, error.batchIndex());
        assertInstanceOf(TransientProviderException.class, error.getCause());
    }

    @Test
    void shouldNotRetryFatalFailures() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4)
                .failAlways(ProviderFailure.AUTHENTICATION, 1);
        EmbeddingClient client = client(provider, settings(10, 5, Duration.ZERO));

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> client.embed(KEY, List.of("one segment here")));

        assertEquals(1, provider.requests().size());
        assertEquals(1, error.attempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRejectVectorsOfWrongDimension() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(3);
        EmbeddingClient client = client(provider, settings(10, 5, Duration.ZERO));

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> client.embed(KEY, List.of("one segment here")));

        FatalProviderException cause = assertInstanceOf(FatalProviderException.class, error.getCause());
        assertEquals(ProviderFailure.DIMENSION_MISMATCH, cause.failure());
        assertEquals(1, provider.requests().size());
    }

    @Test
    void shouldRejectResponsesWithMissingVectors() {
        EmbeddingProvider shortProvider = (request, apiKey) -> List.of(new float[4]);
        EmbeddingClient client = client(shortProvider, settings(10, 5, Duration.ZERO));

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> client.embed(KEY, List.of("first segment", "second segment")));

        FatalProviderException cause = assertInstanceOf(FatalProviderException.class, error.getCause());
        assertEquals(ProviderFailure.MALFORMED_RESPONSE, cause.failure());
    }

    @Test
    void shouldStopWhenCheckpointAborts() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4);
        EmbeddingClient client = client(provider, settings(1, 3, Duration.ZERO));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> client.embed(KEY, List.of("a b c", "d e f", "g h i"), batchIndex -> {
                    if (batchIndex == 1) {
                        throw new IllegalStateException("stop");
                    }
                }));

        assertEquals("stop", error.getMessage());
        assertEquals(1, provider.requests().size());
    }

    @Test
    void shouldBoundBackoffByMaxDelayPlusJitter() {
        EmbeddingSettings settings = new EmbeddingSettings("model", 4, 10, 6, Duration.ofSeconds(4),
                Duration.ofSeconds(10), Duration.ZERO);
        EmbeddingClient client = new EmbeddingClient(new FakeEmbeddingProvider(4), settings, recordingSleeper,
                new Random(7), System::nanoTime);

        Duration first = client.backoff(1);
        Duration fifth = client.backoff(5);

        assertTrue(first.toMillis() >= 4000 && first.toMillis() < 8000, "first=" + first);
        assertTrue(fifth.toMillis() >= 10000 && fifth.toMillis() < 14000, "fifth=" + fifth);
    }

    @Test
    void shouldSpaceConsecutiveCallsWithTheSameKey() {
        AtomicLong clock = new AtomicLong(0);
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4);
        EmbeddingClient client = new EmbeddingClient(provider, settings(1, 3, Duration.ofSeconds(2)),
                recordingSleeper, new Random(1), clock::get);

        client.embed(KEY, List.of("a b c", "d e f"));

        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void shouldKeepApiKeyOutOfFailureMessages() {
        FakeEmbeddingProvider provider = new FakeEmbeddingProvider(4)
                .failAlways(ProviderFailure.AUTHENTICATION, 1);

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> client(provider, settings(10, 1, Duration.ZERO)).embed(KEY, List.of("some text")));

        assertFalse(error.getMessage().contains(KEY));
        assertEquals(KEY, provider.keys().get(0));
    }

    private EmbeddingClient client(EmbeddingProvider provider, EmbeddingSettings settings) {
        return new EmbeddingClient(provider, settings, recordingSleeper, new Random(42), System::nanoTime);
    }

    private static EmbeddingSettings settings(int batchSize, int maxAttempts, Duration requestDelay) {
        return new EmbeddingSettings("test-model", 4, batchSize, maxAttempts, Duration.ofMillis(10),
                Duration.ofMillis(100), requestDelay);
    }
}
