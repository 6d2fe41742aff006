package com.embedbot.ingest;

import java.util.List;

/**
 * Routes a document to the first parser that supports its format.
 */
public class DocumentParsers implements DocumentParser {
    private final List<DocumentParser> parsers;

    public DocumentParsers(List<DocumentParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public static DocumentParsers defaults() {
        return new DocumentParsers(List.of(
                new TextDocumentParser(List.of(".txt", ".md", ".markdown")),
                new CsvDocumentParser(),
                new DocxDocumentParser()));
    }

    @Override
    public boolean supports(String formatHint) {
        return parsers.stream().anyMatch(parser -> parser.supports(formatHint));
    }

    @Override
    public String parse(byte[] content, String formatHint) {
        for (DocumentParser parser : parsers) {
            if (parser.supports(formatHint)) {
                return parser.parse(content, formatHint);
            }
        }
        throw new ParsingException("No parser for format " + formatHint);
    }
}
