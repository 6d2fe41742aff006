package com.embedbot.ingest;

/**
 * Extracts plain text from an uploaded document. The format hint is the lower-case file
 * extension including the dot, for example {@code .csv}.
 */
public interface DocumentParser {
    boolean supports(String formatHint);

    String parse(byte[] content, String formatHint) throws ParsingException;
}
