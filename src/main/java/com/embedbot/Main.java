package com.embedbot;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.chat.ChatReply;
import com.embedbot.chat.ConsoleChatGateway;
import com.embedbot.ingest.ExportArchive;
import com.embedbot.ingest.UploadedFile;
import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.AppConfigLoader;
import com.embedbot.tenant.Tenant;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "embedbot",
        mixinStandardHelpOptions = true,
        version = "embedbot 0.1.0",
        description = "Multi-tenant document embedding bot.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: console, reset-schema, export, history", defaultValue = "console")
    String mode;

    @Option(names = "--chat-id", description = "Chat session id of the tenant")
    Long chatId;

    @Option(names = "--username", description = "User name reported for the console session", defaultValue = "console")
    String username;

    @Option(names = "--file-id", description = "Uploaded file id for export mode")
    Long fileId;

    @Option(names = "--out", description = "Output path for export mode, or directory for console attachments", defaultValue = ".embedbot/exports")
    Path out;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfigLoader.load(configPath, System.getenv());
        log.info("Starting embedbot in {} mode", mode);
        switch (mode) {
            case "console":
                return runConsole(config);
            case "reset-schema":
                return runResetSchema(config);
            case "export":
                return runExport(config);
            case "history":
                return runHistory(config);
            default:
                log.error("Unknown --mode {}; expected console, reset-schema, export or history", mode);
                return 2;
        }
    }

    private int runConsole(AppConfig config) throws Exception {
        if (chatId == null) {
            log.error("--chat-id is required in console mode");
            return 2;
        }
        ConsoleChatGateway gateway = new ConsoleChatGateway(System.out, out);
        try (Embedbot embedbot = Embedbot.start(config, gateway)) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            gateway.run(reader, chatId, username, embedbot.dispatcher());
        }
        return 0;
    }

    private int runResetSchema(AppConfig config) {
        if (chatId == null) {
            log.error("--chat-id is required in reset-schema mode");
            return 2;
        }
        try (Embedbot embedbot = Embedbot.start(config, Main::logReply)) {
            Tenant tenant = embedbot.registry().require(chatId);
            embedbot.router().resetSchema(tenant);
            System.out.println("Segment table of tenant " + tenant.id() + " was dropped and recreated.");
        }
        return 0;
    }

    private int runExport(AppConfig config) throws Exception {
        if (chatId == null || fileId == null) {
            log.error("--chat-id and --file-id are required in export mode");
            return 2;
        }
        try (Embedbot embedbot = Embedbot.start(config, Main::logReply)) {
            Tenant tenant = embedbot.registry().require(chatId);
            ExportArchive archive = embedbot.exportBuilder().export(tenant, fileId);
            Path target = Files.isDirectory(out) || !out.toString().endsWith(".zip")
                    ? out.resolve(archive.fileName())
                    : out;
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, archive.content());
            System.out.println("Export written to " + target);
        }
        return 0;
    }

    private int runHistory(AppConfig config) {
        if (chatId == null) {
            log.error("--chat-id is required in history mode");
            return 2;
        }
        try (Embedbot embedbot = Embedbot.start(config, Main::logReply)) {
            Tenant tenant = embedbot.registry().require(chatId);
            List<UploadedFile> files = embedbot.coordinator().history(tenant, config.getIngestion().getHistorySize());
            for (UploadedFile file : files) {
                System.out.printf("%d\t%s\t%s\t%s%n", file.id(), file.status().code(), file.uploadedAt(),
                        file.fileName());
            }
        }
        return 0;
    }

    private static void logReply(long chatId, ChatReply reply) {
        log.info("reply chatId={} text={}", chatId, reply.text());
    }
}
