package com.embedbot.embedding;

/**
 * Raised by {@link EmbeddingClient} when a batch could not be embedded. No vectors of the call are
 * returned once this is thrown.
 */
public class EmbeddingProviderException extends RuntimeException {
    private final int batchIndex;
    private final int attempts;

    public EmbeddingProviderException(int batchIndex, int attempts, String message, Throwable cause) {
        super("Embedding batch " + batchIndex + " failed after " + attempts + " attempt(s): " + message, cause);
        this.batchIndex = batchIndex;
        this.attempts = attempts;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int attempts() {
        return attempts;
    }
}
