package com.embedbot.ingest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

/**
 * Word documents: the non-blank paragraphs of the main body, one per line.
 */
public class DocxDocumentParser implements DocumentParser {

    @Override
    public boolean supports(String formatHint) {
        return ".docx".equals(formatHint);
    }

    @Override
    public String parse(byte[] content, String formatHint) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            List<String> paragraphs = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String text = paragraph.getText().strip();
                if (!text.isEmpty()) {
                    paragraphs.add(text);
                }
            }
            return String.join("\n", paragraphs);
        } catch (IOException | UnsupportedFileFormatException | POIXMLException e) {
            throw new ParsingException("The file is not a readable Word document.", e);
        }
    }
}
