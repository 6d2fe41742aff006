package com.embedbot.chat;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.ingest.ExportArchive;
import com.embedbot.ingest.ExportBuilder;
import com.embedbot.ingest.ExportNotFoundException;
import com.embedbot.ingest.FileNotFoundForTenantException;
import com.embedbot.ingest.FileStatus;
import com.embedbot.ingest.IngestionCoordinator;
import com.embedbot.ingest.OnboardingIncompleteException;
import com.embedbot.ingest.UploadRejectedException;
import com.embedbot.ingest.UploadedFile;
import com.embedbot.onboarding.OnboardingReply;
import com.embedbot.onboarding.OnboardingValidator;
import com.embedbot.runtime.PersistenceException;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.Tenant;
import com.embedbot.vectorstore.SchemaException;
import com.embedbot.vectorstore.VectorStoreRouter;

/**
 * Turns chat events into onboarding answers, uploads and commands, and sends the replies.
 */
public class ChatCommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ChatCommandDispatcher.class);

    static final String HELP = String.join("\n",
            "/start - set up or check your connection",
            "/upload - upload a document for embedding",
            "/history - recent uploads",
            "/export <id> - download the original file and its segments",
            "/reprocess <id> - process an uploaded file again",
            "/retry_setup - enter the connection details again",
            "/rotate_keys - replace the embedding provider key",
            "/reset_schema - drop and recreate your segment table",
            "/cancel - stop setup or processing",
            "/help - this list");
    static final String RESET_CONFIRMATION = "YES";

    private final JdbcTenantRegistry registry;
    private final OnboardingValidator onboarding;
    private final IngestionCoordinator coordinator;
    private final ExportBuilder exportBuilder;
    private final VectorStoreRouter router;
    private final ReplySink sink;
    private final int historySize;
    private final Set<Long> awaitingResetConfirmation = ConcurrentHashMap.newKeySet();

    public ChatCommandDispatcher(JdbcTenantRegistry registry,
            OnboardingValidator onboarding,
            IngestionCoordinator coordinator,
            ExportBuilder exportBuilder,
            VectorStoreRouter router,
            ReplySink sink,
            int historySize) {
        this.registry = registry;
        this.onboarding = onboarding;
        this.coordinator = coordinator;
        this.exportBuilder = exportBuilder;
        this.router = router;
        this.sink = sink;
        this.historySize = historySize;
    }

    public void handle(ChatEvent event) {
        Tenant tenant = registry.getOrCreate(event.chatId(), event.username(), event.displayName());
        try {
            if (event.isDocument()) {
                handleDocument(tenant, event.document());
                return;
            }
            String text = event.text() == null ? "" : event.text().strip();
            if (awaitingResetConfirmation.remove(tenant.id())) {
                confirmReset(tenant, text);
                return;
            }
            if (text.startsWith("/")) {
                handleCommand(tenant, text);
            } else if (onboarding.isActive(tenant) || !tenant.isOnboarded()) {
                send(tenant, onboarding.accept(tenant, event.text()));
            } else {
                reply(tenant, "Send a document to embed it, or /help for the list of commands.");
            }
        } catch (OnboardingIncompleteException | UploadRejectedException | FileNotFoundForTenantException
                | ExportNotFoundException e) {
            reply(tenant, e.getMessage());
        } catch (SchemaException | PersistenceException e) {
            log.warn("chat.command.failed tenantId={} error={}", tenant.id(), e.getMessage());
            reply(tenant, "The database operation failed. Please try again later.");
        } catch (RuntimeException e) {
            log.error("chat.command.unexpected tenantId={}", tenant.id(), e);
            reply(tenant, "Something went wrong. Please try again later.");
        }
    }

    private void handleCommand(Tenant tenant, String text) {
        String[] parts = text.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        String argument = parts.length > 1 ? parts[1].strip() : "";
        log.debug("chat.command tenantId={} command={}", tenant.id(), command);
        switch (command) {
            case "/start" -> send(tenant, onboarding.start(tenant));
            case "/help" -> reply(tenant, HELP);
            case "/cancel" -> cancel(tenant);
            case "/retry_setup" -> send(tenant, onboarding.restart(tenant));
            case "/rotate_keys" -> send(tenant, onboarding.startRotation(tenant));
            case "/upload" -> upload(tenant);
            case "/history" -> reply(tenant, HistoryFormatter.format(coordinator.history(tenant, historySize)));
            case "/export" -> export(tenant, argument);
            case "/reprocess" -> reprocess(tenant, argument);
            case "/reset_schema" -> requestReset(tenant);
            default -> reply(tenant, "Unknown command " + command + ". Send /help for the list of commands.");
        }
    }

    private void handleDocument(Tenant tenant, ChatEvent.Document document) {
        if (onboarding.isActive(tenant)) {
            reply(tenant, "Finish the setup first, or send /cancel to stop it.");
            return;
        }
        UploadedFile file = coordinator.register(tenant, document.fileName(), document.content());
        reply(tenant, "Received " + file.fileName() + " (id " + file.id() + "). Processing started.");
        watch(tenant, coordinator.submit(tenant, file.id()));
    }

    private void upload(Tenant tenant) {
        if (!registry.canRoute(tenant)) {
            throw new OnboardingIncompleteException("Finish setup with /start before uploading documents.");
        }
        reply(tenant, "Send the document as a file. " + coordinator.uploadPolicy().describe());
    }

    private void cancel(Tenant tenant) {
        if (onboarding.isActive(tenant)) {
            send(tenant, onboarding.cancel(tenant));
            return;
        }
        int cancelled = coordinator.cancelAll(tenant);
        reply(tenant, cancelled == 0 ? "Nothing to cancel." : "Cancelling " + cancelled + " job(s).");
    }

    private void export(Tenant tenant, String argument) {
        long fileId = parseFileId(tenant, argument, "/export");
        if (fileId < 0) {
            return;
        }
        ExportArchive archive;
        try {
            archive = exportBuilder.export(tenant, fileId);
        } catch (IOException e) {
            log.warn("chat.export.failed tenantId={} fileId={} error={}", tenant.id(), fileId, e.getMessage());
            reply(tenant, "The original file could not be read, so the export was not built.");
            return;
        }
        sink.send(tenant.chatId(), ChatReply.attachment("Export of file " + fileId, archive.fileName(),
                archive.content()));
    }

    private void reprocess(Tenant tenant, String argument) {
        long fileId = parseFileId(tenant, argument, "/reprocess");
        if (fileId < 0) {
            return;
        }
        CompletableFuture<UploadedFile> job = coordinator.reprocess(tenant, fileId);
        reply(tenant, "File " + fileId + " queued for processing.");
        watch(tenant, job);
    }

    private void requestReset(Tenant tenant) {
        if (!registry.canRoute(tenant)) {
            throw new OnboardingIncompleteException("Finish setup with /start first.");
        }
        awaitingResetConfirmation.add(tenant.id());
        reply(tenant, "This deletes every stored segment of every file. Send " + RESET_CONFIRMATION
                + " to confirm, anything else to keep your data.");
    }

    private void confirmReset(Tenant tenant, String text) {
        if (!RESET_CONFIRMATION.equals(text)) {
            reply(tenant, "Reset cancelled. Your data was not changed.");
            return;
        }
        router.resetSchema(tenant);
        log.warn("chat.reset_schema tenantId={}", tenant.id());
        reply(tenant, "The segment table was recreated. Previously processed files need /reprocess.");
    }

    private void watch(Tenant tenant, CompletableFuture<UploadedFile> job) {
        job.whenComplete((file, error) -> {
            if (error != null) {
                log.error("chat.job.unexpected tenantId={}", tenant.id(), error);
                reply(tenant, "Processing stopped unexpectedly. Please try again later.");
            } else if (file.status() == FileStatus.STORED) {
                reply(tenant, "File " + file.id() + " (" + file.fileName() + ") is ready. Download it with /export "
                        + file.id() + ".");
            } else {
                reply(tenant, "Processing of file " + file.id() + " failed: " + file.errorMessage());
            }
        });
    }

    private long parseFileId(Tenant tenant, String argument, String command) {
        try {
            long id = Long.parseLong(argument.startsWith("#") ? argument.substring(1) : argument);
            if (id > 0) {
                return id;
            }
        } catch (NumberFormatException e) {
            log.debug("chat.command.bad_argument command={} argument={}", command, argument);
        }
        reply(tenant, "Usage: " + command + " <file id>. See /history for ids.");
        return -1;
    }

    private void send(Tenant tenant, OnboardingReply reply) {
        for (String message : reply.messages()) {
            reply(tenant, message);
        }
    }

    private void reply(Tenant tenant, String text) {
        sink.send(tenant.chatId(), ChatReply.text(text));
    }
}
