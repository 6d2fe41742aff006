package com.embedbot.runtime;

/**
 * A database operation failed for a reason other than a recoverable schema problem.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
