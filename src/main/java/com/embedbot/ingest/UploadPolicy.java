package com.embedbot.ingest;

import java.util.List;
import java.util.Locale;

import com.embedbot.runtime.AppConfig;

public record UploadPolicy(List<String> allowedExtensions, long maxBytes) {

    public UploadPolicy {
        allowedExtensions = allowedExtensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
    }

    public static UploadPolicy from(AppConfig.IngestionConfig config) {
        return new UploadPolicy(config.getAllowedExtensions(), config.getMaxUploadMb() * 1024L * 1024L);
    }

    /**
     * @throws UploadRejectedException when the extension is not allowed or the file is empty or too large
     */
    public void check(String fileName, long sizeBytes) {
        String name = fileName == null ? "" : fileName;
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
        if (!allowedExtensions.contains(extension)) {
            throw new UploadRejectedException("File format " + (extension.isEmpty() ? "without extension" : extension)
                    + " is not supported. Allowed: " + String.join(", ", allowedExtensions) + ".");
        }
        if (sizeBytes <= 0) {
            throw new UploadRejectedException("The file is empty.");
        }
        if (sizeBytes > maxBytes) {
            throw new UploadRejectedException("File size exceeds " + maxBytes / (1024 * 1024) + " MB.");
        }
    }

    public String describe() {
        return "Supported formats: " + String.join(", ", allowedExtensions) + ". Maximum size: "
                + maxBytes / (1024 * 1024) + " MB.";
    }
}
