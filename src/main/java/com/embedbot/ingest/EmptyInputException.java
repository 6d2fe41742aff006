package com.embedbot.ingest;

public class EmptyInputException extends RuntimeException {

    public EmptyInputException(String message) {
        super(message);
    }
}
