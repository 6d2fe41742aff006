package com.embedbot.ingest;

public record ExportArchive(String fileName, byte[] content) {
}
