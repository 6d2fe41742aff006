package com.embedbot.chat;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single chat session on standard input and output. A line {@code /file <path>} uploads the
 * file at that path; attachments are written to the output directory.
 */
public class ConsoleChatGateway implements ReplySink {
    private static final Logger log = LoggerFactory.getLogger(ConsoleChatGateway.class);
    static final String FILE_COMMAND = "/file ";

    private final PrintStream out;
    private final Path attachmentDir;

    public ConsoleChatGateway(PrintStream out, Path attachmentDir) {
        this.out = out;
        this.attachmentDir = attachmentDir;
    }

    public void run(BufferedReader in, long chatId, String username, ChatCommandDispatcher dispatcher)
            throws IOException {
        out.println("embedbot console ready for chat " + chatId + ". Type /help for commands, /exit to quit.");
        String line;
        while ((line = in.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.equals("/exit") || trimmed.equals("/quit")) {
                break;
            }
            if (trimmed.startsWith(FILE_COMMAND)) {
                Path path = Path.of(trimmed.substring(FILE_COMMAND.length()).strip());
                if (!Files.isRegularFile(path)) {
                    out.println("bot> No such file: " + path);
                    continue;
                }
                dispatcher.handle(ChatEvent.document(chatId, username, username, path.getFileName().toString(),
                        Files.readAllBytes(path)));
            } else {
                dispatcher.handle(ChatEvent.text(chatId, username, username, line));
            }
        }
    }

    @Override
    public synchronized void send(long chatId, ChatReply reply) {
        if (reply.text() != null) {
            out.println("bot> " + reply.text());
        }
        if (reply.hasAttachment()) {
            Path target = attachmentDir.resolve(reply.attachment().fileName());
            try {
                Files.createDirectories(attachmentDir);
                Files.write(target, reply.attachment().content());
                out.println("bot> [attachment saved to " + target + "]");
            } catch (IOException e) {
                log.warn("console.attachment.failed path={} error={}", target, e.getMessage());
                out.println("bot> [attachment could not be saved: " + e.getMessage() + "]");
            }
        }
    }
}
