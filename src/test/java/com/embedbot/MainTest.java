package com.embedbot;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRejectUnknownMode() {
        int exitCode = new CommandLine(new Main()).execute("--config", tempDir.resolve("none.yml").toString(),
                "--mode", "benchmark");

        assertEquals(2, exitCode);
    }

    @Test
    void shouldRequireChatIdForExport() {
        int exitCode = new CommandLine(new Main()).execute("--config", tempDir.resolve("none.yml").toString(),
                "--mode", "export", "--file-id", "3");

        assertEquals(2, exitCode);
    }

    @Test
    void shouldRejectNonNumericChatId() {
        int exitCode = new CommandLine(new Main()).execute("--chat-id", "abc");

        assertEquals(2, exitCode);
    }
}
