package com.embedbot.ingest;

public class ExportNotFoundException extends RuntimeException {

    public ExportNotFoundException(String message) {
        super(message);
    }
}
