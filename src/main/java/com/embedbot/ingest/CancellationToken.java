package com.embedbot.ingest;

/**
 * Cooperative cancellation flag for one processing job.
 */
public final class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled(String checkpoint) {
        if (cancelled) {
            throw new JobCancelledException("Processing was cancelled before " + checkpoint + ".");
        }
    }
}
