package com.embedbot.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins the non-blank cells of each CSV row with spaces, one row per line. Quoted cells may
 * contain commas, doubled quotes and line breaks.
 */
public class CsvDocumentParser implements DocumentParser {

    @Override
    public boolean supports(String formatHint) {
        return ".csv".equals(formatHint);
    }

    @Override
    public String parse(byte[] content, String formatHint) {
        String text = TextDocumentParser.decode(content);
        List<String> lines = new ArrayList<>();
        for (List<String> row : rows(text)) {
            List<String> cells = new ArrayList<>();
            for (String cell : row) {
                if (!cell.isBlank()) {
                    cells.add(cell.strip());
                }
            }
            if (!cells.isEmpty()) {
                lines.add(String.join(" ", cells));
            }
        }
        return lines.isEmpty() ? text : String.join("\n", lines);
    }

    static List<List<String>> rows(String text) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                row.add(cell.toString());
                cell.setLength(0);
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                row.add(cell.toString());
                cell.setLength(0);
                rows.add(row);
                row = new ArrayList<>();
            } else {
                cell.append(c);
            }
        }
        if (cell.length() > 0 || !row.isEmpty()) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }
}
