package com.embedbot.ingest;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.embedbot.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadPolicyTest {
    private final UploadPolicy policy = UploadPolicy.from(new AppConfig().getIngestion());

    @Test
    void shouldAcceptAllowedExtensionsCaseInsensitively() {
        assertDoesNotThrow(() -> policy.check("Report.DOCX", 1024));
        assertDoesNotThrow(() -> policy.check("notes.md", 1));
    }

    @Test
    void shouldRejectUnsupportedFormats() {
        UploadRejectedException error = assertThrows(UploadRejectedException.class,
                () -> policy.check("scan.pdf", 1024));

        assertTrue(error.getMessage().contains(".pdf"));
        assertThrows(UploadRejectedException.class, () -> policy.check("README", 10));
    }

    @Test
    void shouldRejectEmptyAndOversizedFiles() {
        assertThrows(UploadRejectedException.class, () -> policy.check("empty.txt", 0));
        assertThrows(UploadRejectedException.class, () -> policy.check("big.txt", 15L * 1024 * 1024 + 1));
        assertDoesNotThrow(() -> policy.check("max.txt", 15L * 1024 * 1024));
    }

    @Test
    void shouldDescribeLimits() {
        UploadPolicy custom = new UploadPolicy(List.of(".TXT"), 2L * 1024 * 1024);

        assertEquals("Supported formats: .txt. Maximum size: 2 MB.", custom.describe());
    }
}
