package com.embedbot.vectorstore;

/**
 * One segment and its vector, ready to be written.
 */
public record SegmentRecord(int index, String title, String body, float[] vector) {

    public static String title(String fileName, long fileId, int index) {
        return fileName + "|" + fileId + "|" + index;
    }
}
