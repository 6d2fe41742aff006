package com.embedbot.ingest;

public class FileNotFoundForTenantException extends RuntimeException {

    public FileNotFoundForTenantException(long fileId) {
        super("File " + fileId + " was not found.");
    }
}
