package com.embedbot.embedding;

/**
 * Invoked before each batch is sent; implementations throw to abort the remaining batches.
 */
@FunctionalInterface
public interface BatchCheckpoint {
    BatchCheckpoint NONE = batchIndex -> {
    };

    void beforeBatch(int batchIndex);
}
