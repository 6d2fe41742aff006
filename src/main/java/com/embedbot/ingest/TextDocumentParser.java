package com.embedbot.ingest;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain text and markdown. Bytes are decoded as UTF-8 when valid, otherwise as windows-1251,
 * and finally as ISO-8859-1, which accepts any input.
 */
public class TextDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(TextDocumentParser.class);
    private static final List<Charset> STRICT_CHARSETS = List.of(StandardCharsets.UTF_8, Charset.forName("windows-1251"));

    private final List<String> extensions;

    public TextDocumentParser(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public boolean supports(String formatHint) {
        return extensions.contains(formatHint);
    }

    @Override
    public String parse(byte[] content, String formatHint) {
        return decode(content);
    }

    static String decode(byte[] content) {
        for (Charset charset : STRICT_CHARSETS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString();
                return text.startsWith("\uFEFF") ? text.substring(1) : text;
            } catch (CharacterCodingException e) {
                log.debug("parser.text.charset.rejected charset={}", charset.name());
            }
        }
        return new String(content, StandardCharsets.ISO_8859_1);
    }
}
