package com.embedbot.embedding;

public class TransientProviderException extends ProviderException {

    public TransientProviderException(ProviderFailure failure, int statusCode, String message, Throwable cause) {
        super(failure, statusCode, message, cause);
    }
}
