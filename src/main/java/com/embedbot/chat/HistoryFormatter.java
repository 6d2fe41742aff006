package com.embedbot.chat;

import java.time.format.DateTimeFormatter;
import java.util.List;

import com.embedbot.ingest.FileStatus;
import com.embedbot.ingest.UploadedFile;

final class HistoryFormatter {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private HistoryFormatter() {
    }

    static String format(List<UploadedFile> files) {
        if (files.isEmpty()) {
            return "No uploads yet. Send a document to get started.";
        }
        StringBuilder text = new StringBuilder("Recent uploads:");
        for (UploadedFile file : files) {
            text.append('\n')
                    .append('#').append(file.id()).append(' ')
                    .append(file.fileName()).append(": ")
                    .append(file.status().code())
                    .append(" (").append(file.uploadedAt().format(TIMESTAMP)).append(')');
            if (file.status() == FileStatus.FAILED && file.errorMessage() != null) {
                text.append("\n    ").append(file.errorMessage());
            }
        }
        return text.toString();
    }
}
