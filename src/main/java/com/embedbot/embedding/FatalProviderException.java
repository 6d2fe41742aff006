package com.embedbot.embedding;

public class FatalProviderException extends ProviderException {

    public FatalProviderException(ProviderFailure failure, int statusCode, String message, Throwable cause) {
        super(failure, statusCode, message, cause);
    }
}
