package com.embedbot.ingest;

import java.time.OffsetDateTime;
import java.util.Locale;

public record UploadedFile(
        long id,
        long tenantId,
        String fileName,
        long sizeBytes,
        String storageKey,
        FileStatus status,
        String errorMessage,
        OffsetDateTime uploadedAt,
        OffsetDateTime processedAt) {

    public String extension() {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
