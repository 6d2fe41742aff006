package com.embedbot.ingest;

import java.util.Locale;

public enum FileStatus {
    PENDING,
    PARSING,
    SEGMENTING,
    EMBEDDING,
    STORED,
    FAILED,
    EXPORTED;

    public boolean isTerminal() {
        return this == STORED || this == FAILED || this == EXPORTED;
    }

    public boolean hasStoredSegments() {
        return this == STORED || this == EXPORTED;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileStatus fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
