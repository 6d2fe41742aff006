package com.embedbot.vectorstore;

/**
 * The tenant's segment table could not be provisioned, or is still missing after recovery.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
