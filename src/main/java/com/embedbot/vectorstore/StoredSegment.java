package com.embedbot.vectorstore;

public record StoredSegment(long id, long fileId, int index, String title, String body, float[] vector) {
}
