package com.embedbot.tenant;

public class CredentialMissingException extends RuntimeException {

    public CredentialMissingException(String message) {
        super(message);
    }
}
