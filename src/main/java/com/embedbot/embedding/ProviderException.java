package com.embedbot.embedding;

/**
 * Failure of a single provider call. Messages never contain the API key.
 */
public abstract class ProviderException extends RuntimeException {
    private final ProviderFailure failure;
    private final int statusCode;

    protected ProviderException(ProviderFailure failure, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.statusCode = statusCode;
    }

    public ProviderFailure failure() {
        return failure;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int statusCode() {
        return statusCode;
    }

    public static ProviderException of(ProviderFailure failure, int statusCode, String message) {
        return of(failure, statusCode, message, null);
    }

    public static ProviderException of(ProviderFailure failure, int statusCode, String message, Throwable cause) {
        if (failure.isTransient()) {
            return new TransientProviderException(failure, statusCode, message, cause);
        }
        return new FatalProviderException(failure, statusCode, message, cause);
    }
}
