package com.embedbot.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.embedding.EmbeddingClient;
import com.embedbot.embedding.EmbeddingProviderException;
import com.embedbot.runtime.PersistenceException;
import com.embedbot.tenant.CredentialMissingException;
import com.embedbot.tenant.DecryptionFailedException;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.Tenant;
import com.embedbot.vectorstore.SchemaException;
import com.embedbot.vectorstore.SegmentRecord;
import com.embedbot.vectorstore.VectorStoreRouter;

/**
 * Runs uploaded files through parse, segment, embed and store. Jobs of one tenant run one at
 * a time in submission order; jobs of different tenants run in parallel on the worker pool.
 * A failed stage marks the file failed with a reason and ends the job; nothing is retried
 * unless {@link #reprocess} is called.
 */
public class IngestionCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final JdbcTenantRegistry registry;
    private final JdbcUploadedFileRepository files;
    private final BlobStorage blobs;
    private final DocumentParser parser;
    private final Segmenter segmenter;
    private final EmbeddingClient embeddingClient;
    private final VectorStoreRouter router;
    private final UploadPolicy uploadPolicy;
    private final ExecutorService workers;
    private final Map<Long, CompletableFuture<UploadedFile>> tails = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Long, Set<CancellationToken>> running = new ConcurrentHashMap<>();

    public IngestionCoordinator(JdbcTenantRegistry registry,
            JdbcUploadedFileRepository files,
            BlobStorage blobs,
            DocumentParser parser,
            Segmenter segmenter,
            EmbeddingClient embeddingClient,
            VectorStoreRouter router,
            UploadPolicy uploadPolicy,
            ExecutorService workers) {
        this.registry = registry;
        this.files = files;
        this.blobs = blobs;
        this.parser = parser;
        this.segmenter = segmenter;
        this.embeddingClient = embeddingClient;
        this.router = router;
        this.uploadPolicy = uploadPolicy;
        this.workers = workers;
    }

    public UploadPolicy uploadPolicy() {
        return uploadPolicy;
    }

    /**
     * Checks the upload against the policy, keeps the original bytes and records a pending file.
     *
     * @throws UploadRejectedException for a disallowed extension or size
     * @throws OnboardingIncompleteException when the tenant cannot be routed yet
     */
    public UploadedFile register(Tenant tenant, String fileName, byte[] content) {
        requireRoutable(tenant);
        uploadPolicy.check(fileName, content.length);
        String storageKey;
        try {
            storageKey = blobs.store(tenant.chatId(), fileName, content);
        } catch (IOException e) {
            throw new PersistenceException("Unable to store upload " + fileName, e);
        }
        UploadedFile file = files.insert(tenant.id(), fileName, content.length, storageKey);
        log.info("ingest.registered tenantId={} fileId={} name={} bytes={}", tenant.id(), file.id(), fileName,
                content.length);
        return file;
    }

    /**
     * Queues processing behind the tenant's earlier jobs. The future completes with the final
     * file row, {@link FileStatus#STORED} or {@link FileStatus#FAILED}.
     */
    public CompletableFuture<UploadedFile> submit(Tenant tenant, long fileId) {
        requireRoutable(tenant);
        requireFile(tenant, fileId);
        CancellationToken token = track(fileId);
        CompletableFuture<UploadedFile> job = tails.compute(tenant.id(), (id, tail) -> {
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous.handle((result, error) -> null)
                    .thenApplyAsync(ignored -> runJob(tenant, fileId, token), workers);
        });
        job.whenComplete((result, error) -> tails.remove(tenant.id(), job));
        log.info("ingest.submitted tenantId={} fileId={}", tenant.id(), fileId);
        return job;
    }

    /**
     * Processes a file on the calling thread, still serialized with the tenant's queued jobs.
     */
    public UploadedFile process(Tenant tenant, long fileId) {
        requireRoutable(tenant);
        requireFile(tenant, fileId);
        return runJob(tenant, fileId, track(fileId));
    }

    public CompletableFuture<UploadedFile> reprocess(Tenant tenant, long fileId) {
        UploadedFile file = requireFile(tenant, fileId);
        log.info("ingest.reprocess tenantId={} fileId={} previousStatus={}", tenant.id(), fileId, file.status().code());
        return submit(tenant, fileId);
    }

    /**
     * Requests cancellation of a queued or running job. Takes effect at the next checkpoint:
     * before parsing, before each embedding batch, or before the segments are written.
     *
     * Every queued or running job of the file is cancelled.
     *
     * @return false when the file has no job in progress
     */
    public boolean cancel(Tenant tenant, long fileId) {
        requireFile(tenant, fileId);
        int cancelled = cancelJobs(fileId);
        if (cancelled == 0) {
            return false;
        }
        log.info("ingest.cancel.requested tenantId={} fileId={} jobs={}", tenant.id(), fileId, cancelled);
        return true;
    }

    /**
     * Cancels every job of the tenant that is queued or running.
     */
    public int cancelAll(Tenant tenant) {
        int cancelled = 0;
        for (UploadedFile file : files.recent(tenant.id(), Integer.MAX_VALUE)) {
            cancelled += cancelJobs(file.id());
        }
        return cancelled;
    }

    public List<UploadedFile> history(Tenant tenant, int limit) {
        return files.recent(tenant.id(), limit);
    }

    public UploadedFile requireFile(Tenant tenant, long fileId) {
        return files.find(tenant.id(), fileId).orElseThrow(() -> new FileNotFoundForTenantException(fileId));
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private UploadedFile runJob(Tenant tenant, long fileId, CancellationToken token) {
        ReentrantLock lock = locks.computeIfAbsent(tenant.id(), id -> new ReentrantLock());
        lock.lock();
        try {
            UploadedFile file = requireFile(tenant, fileId);
            long started = System.nanoTime();
            try {
                int count = runStages(tenant, file, token);
                files.markStored(fileId);
                log.info("ingest.stored tenantId={} fileId={} segments={} elapsedMs={}", tenant.id(), fileId, count,
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            } catch (IOException e) {
                fail(tenant, file, "The original file could not be read.", e);
            } catch (ParsingException | EmptyInputException | JobCancelledException | EmbeddingProviderException e) {
                fail(tenant, file, e.getMessage(), e);
            } catch (SchemaException | PersistenceException e) {
                fail(tenant, file, "Saving to your vector database failed. Check the database and try /reprocess "
                        + fileId + ".", e);
            } catch (CredentialMissingException | DecryptionFailedException e) {
                fail(tenant, file, "Stored credentials are unavailable. Run /retry_setup.", e);
            } catch (RuntimeException e) {
                log.error("ingest.unexpected tenantId={} fileId={}", tenant.id(), fileId, e);
                fail(tenant, file, "Unable to process the file. Please try again later.", e);
            }
            return requireFile(tenant, fileId);
        } finally {
            untrack(fileId, token);
            lock.unlock();
        }
    }

    private CancellationToken track(long fileId) {
        CancellationToken token = new CancellationToken();
        running.computeIfAbsent(fileId, id -> ConcurrentHashMap.newKeySet()).add(token);
        return token;
    }

    private void untrack(long fileId, CancellationToken token) {
        running.computeIfPresent(fileId, (id, tokens) -> {
            tokens.remove(token);
            return tokens.isEmpty() ? null : tokens;
        });
    }

    private int cancelJobs(long fileId) {
        Set<CancellationToken> tokens = running.get(fileId);
        if (tokens == null) {
            return 0;
        }
        int cancelled = 0;
        for (CancellationToken token : tokens) {
            if (!token.isCancelled()) {
                token.cancel();
                cancelled++;
            }
        }
        return cancelled;
    }

    private int runStages(Tenant tenant, UploadedFile file, CancellationToken token) throws IOException {
        long fileId = file.id();
        token.throwIfCancelled("parsing");
        stage(tenant, fileId, FileStatus.PARSING);
        String text = parser.parse(blobs.load(file.storageKey()), file.extension());

        stage(tenant, fileId, FileStatus.SEGMENTING);
        List<String> segments = segmenter.segment(text).toList();

        stage(tenant, fileId, FileStatus.EMBEDDING);
        return registry.withDecrypted(tenant, credential -> {
            List<float[]> vectors = embeddingClient.embed(credential.providerApiKey(), segments,
                    batchIndex -> token.throwIfCancelled("embedding batch " + (batchIndex + 1)));
            token.throwIfCancelled("saving segments");
            router.write(tenant, fileId, records(file, segments, vectors));
            return segments.size();
        });
    }

    private void stage(Tenant tenant, long fileId, FileStatus status) {
        files.markStage(fileId, status);
        log.info("ingest.stage tenantId={} fileId={} stage={}", tenant.id(), fileId, status.code());
    }

    private void fail(Tenant tenant, UploadedFile file, String reason, Exception cause) {
        files.markFailed(file.id(), reason);
        log.warn("ingest.failed tenantId={} fileId={} reason={} error={}", tenant.id(), file.id(), reason,
                cause.getClass().getSimpleName());
    }

    private void requireRoutable(Tenant tenant) {
        if (!registry.canRoute(tenant)) {
            throw new OnboardingIncompleteException("Finish setup with /start before uploading documents.");
        }
    }

    static List<SegmentRecord> records(UploadedFile file, List<String> segments, List<float[]> vectors) {
        if (segments.size() != vectors.size()) {
            throw new IllegalStateException("Got " + vectors.size() + " vectors for " + segments.size() + " segments");
        }
        List<SegmentRecord> records = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            records.add(new SegmentRecord(i, SegmentRecord.title(file.fileName(), file.id(), i), segments.get(i),
                    vectors.get(i)));
        }
        return records;
    }
}
