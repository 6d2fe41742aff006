package com.embedbot.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds ordered segments in bounded batches, retrying transient provider failures with
 * exponential backoff, jitter and a minimum delay between calls made with the same key.
 */
public class EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingProvider provider;
    private final EmbeddingSettings settings;
    private final Sleeper sleeper;
    private final Random random;
    private final LongSupplier nanoClock;
    private final Map<String, long[]> nextSlotByKey = new ConcurrentHashMap<>();

    public EmbeddingClient(EmbeddingProvider provider, EmbeddingSettings settings) {
        this(provider, settings, Sleeper.SYSTEM, new Random(), System::nanoTime);
    }

    EmbeddingClient(EmbeddingProvider provider,
            EmbeddingSettings settings,
            Sleeper sleeper,
            Random random,
            LongSupplier nanoClock) {
        this.provider = provider;
        this.settings = settings;
        this.sleeper = sleeper;
        this.random = random;
        this.nanoClock = nanoClock;
    }

    public EmbeddingSettings settings() {
        return settings;
    }

    public List<float[]> embed(String apiKey, List<String> segments) {
        return embed(apiKey, segments, BatchCheckpoint.NONE);
    }

    /**
     * @return exactly one vector of {@link EmbeddingSettings#dimensions()} per segment, in segment order
     * @throws EmbeddingProviderException when any batch fails; no partial result is returned
     */
    public List<float[]> embed(String apiKey, List<String> segments, BatchCheckpoint checkpoint) {
        if (segments.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(segments.size());
        int batchCount = (segments.size() + settings.batchSize() - 1) / settings.batchSize();
        for (int batchIndex = 0; batchIndex < batchCount; batchIndex++) {
            checkpoint.beforeBatch(batchIndex);
            int from = batchIndex * settings.batchSize();
            int to = Math.min(segments.size(), from + settings.batchSize());
            List<String> batch = segments.subList(from, to);
            vectors.addAll(embedBatch(apiKey, batch, batchIndex));
            log.debug("embedding.batch.done batch={}/{} size={}", batchIndex + 1, batchCount, batch.size());
        }
        return List.copyOf(vectors);
    }

    private List<float[]> embedBatch(String apiKey, List<String> batch, int batchIndex) {
        EmbeddingRequest request = new EmbeddingRequest(settings.model(), batch);
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            try {
                awaitRequestSlot(apiKey);
                List<float[]> vectors = provider.embed(request, apiKey);
                validate(vectors, batch.size());
                return vectors;
            } catch (FatalProviderException e) {
                log.warn("embedding.batch.fatal batch={} attempt={} failure={} status={}",
                        batchIndex, attempt, e.failure(), e.statusCode());
                throw new EmbeddingProviderException(batchIndex, attempt, e.getMessage(), e);
            } catch (TransientProviderException e) {
                if (attempt == settings.maxAttempts()) {
                    log.error("embedding.batch.exhausted batch={} attempts={} failure={}",
                            batchIndex, attempt, e.failure());
                    throw new EmbeddingProviderException(batchIndex, attempt, e.getMessage(), e);
                }
                Duration backoff = backoff(attempt);
                log.warn("embedding.retry batch={} attempt={} maxAttempts={} backoffMs={} failure={} status={}",
                        batchIndex, attempt, settings.maxAttempts(), backoff.toMillis(), e.failure(), e.statusCode());
                pause(backoff, batchIndex, attempt);
            }
        }
        throw new EmbeddingProviderException(batchIndex, settings.maxAttempts(), "retry budget exhausted", null);
    }

    private void validate(List<float[]> vectors, int expected) {
        if (vectors == null || vectors.size() != expected) {
            throw new FatalProviderException(ProviderFailure.MALFORMED_RESPONSE, 200,
                    "Expected " + expected + " vectors but got " + (vectors == null ? 0 : vectors.size()), null);
        }
        for (float[] vector : vectors) {
            if (vector.length != settings.dimensions()) {
                throw new FatalProviderException(ProviderFailure.DIMENSION_MISMATCH, 200,
                        "Expected dimension " + settings.dimensions() + " but got " + vector.length, null);
            }
        }
    }

    Duration backoff(int attempt) {
        long base = settings.retryBaseDelay().toMillis();
        long exponential = base * (1L << Math.min(attempt - 1, 20));
        long capped = Math.min(exponential, settings.retryMaxDelay().toMillis());
        long jitter = base == 0 ? 0 : (long) (random.nextDouble() * base);
        return Duration.ofMillis(capped + jitter);
    }

    private void awaitRequestSlot(String apiKey) {
        long delayNanos = settings.requestDelay().toNanos();
        if (delayNanos == 0) {
            return;
        }
        String slotKey = apiKey == null ? "" : ApiKeys.fingerprint(apiKey);
        long[] nextSlot = nextSlotByKey.computeIfAbsent(slotKey, unused -> new long[] { Long.MIN_VALUE });
        long waitNanos;
        synchronized (nextSlot) {
            long now = nanoClock.getAsLong();
            long start = nextSlot[0] == Long.MIN_VALUE ? now : Math.max(now, nextSlot[0]);
            nextSlot[0] = start + delayNanos;
            waitNanos = start - now;
        }
        if (waitNanos > 0) {
            pause(Duration.ofNanos(waitNanos), -1, 0);
        }
    }

    private void pause(Duration duration, int batchIndex, int attempt) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException(batchIndex, attempt, "interrupted while waiting", e);
        }
    }
}
