package com.embedbot.ingest;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentParsersTest {
    private final DocumentParsers parsers = DocumentParsers.defaults();

    @Test
    void shouldDecodeUtf8AndStripByteOrderMark() {
        byte[] content = "\uFEFFHello world".getBytes(StandardCharsets.UTF_8);

        assertEquals("Hello world", parsers.parse(content, ".txt"));
    }

    @Test
    void shouldFallBackToCyrillicCodePage() {
        byte[] content = "Привет, мир".getBytes(Charset.forName("windows-1251"));

        assertEquals("Привет, мир", parsers.parse(content, ".md"));
    }

    @Test
    void shouldJoinCsvCellsWithSpaces() {
        byte[] content = "name,comment\r\nAlice,\"Likes tea, not coffee\"\n,,\nBob,\"Said \"\"hi\"\"\"\n"
                .getBytes(StandardCharsets.UTF_8);

        assertEquals("name comment\nAlice Likes tea, not coffee\nBob Said \"hi\"", parsers.parse(content, ".csv"));
    }

    @Test
    void shouldReadDocxParagraphs() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (XWPFDocument document = new XWPFDocument()) {
            document.createParagraph().createRun().setText("First paragraph of the report.");
            document.createParagraph();
            document.createParagraph().createRun().setText("Second paragraph.");
            document.write(buffer);
        }

        assertEquals("First paragraph of the report.\nSecond paragraph.",
                parsers.parse(buffer.toByteArray(), ".docx"));
    }

    @Test
    void shouldRejectCorruptDocx() {
        assertThrows(ParsingException.class,
                () -> parsers.parse("not a zip".getBytes(StandardCharsets.UTF_8), ".docx"));
    }

    @Test
    void shouldRejectUnknownFormat() {
        assertFalse(parsers.supports(".pdf"));
        assertTrue(parsers.supports(".csv"));
        assertThrows(ParsingException.class, () -> parsers.parse(new byte[] {1}, ".pdf"));
    }

    @Test
    void shouldParseQuotedLineBreaksAsOneRow() {
        List<List<String>> rows = CsvDocumentParser.rows("a,\"line one\nline two\"\nb,c");

        assertEquals(List.of(List.of("a", "line one\nline two"), List.of("b", "c")), rows);
    }
}
