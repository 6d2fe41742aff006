package com.embedbot;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.chat.ChatCommandDispatcher;
import com.embedbot.chat.ReplySink;
import com.embedbot.embedding.EmbeddingClient;
import com.embedbot.embedding.EmbeddingProvider;
import com.embedbot.embedding.EmbeddingProviders;
import com.embedbot.embedding.EmbeddingSettings;
import com.embedbot.ingest.DocumentParsers;
import com.embedbot.ingest.ExportBuilder;
import com.embedbot.ingest.FileSystemBlobStorage;
import com.embedbot.ingest.IngestionCoordinator;
import com.embedbot.ingest.JdbcUploadedFileRepository;
import com.embedbot.ingest.Segmenter;
import com.embedbot.ingest.SegmenterSettings;
import com.embedbot.ingest.UploadPolicy;
import com.embedbot.onboarding.EmbeddingKeyProbe;
import com.embedbot.onboarding.JdbcStoreProbe;
import com.embedbot.onboarding.OnboardingValidator;
import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.ControlDatabase;
import com.embedbot.tenant.AesGcmSecretCipher;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.vectorstore.HikariTenantDataSourceFactory;
import com.embedbot.vectorstore.PgVectorDialect;
import com.embedbot.vectorstore.VectorStoreDialect;
import com.embedbot.vectorstore.VectorStoreRouter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.zaxxer.hikari.HikariDataSource;

import okhttp3.OkHttpClient;

/**
 * Wires every component from configuration and owns their lifecycles.
 */
public final class Embedbot implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Embedbot.class);

    private final HikariDataSource controlDataSource;
    private final JdbcTenantRegistry registry;
    private final VectorStoreRouter router;
    private final IngestionCoordinator coordinator;
    private final ExportBuilder exportBuilder;
    private final ChatCommandDispatcher dispatcher;

    private Embedbot(AppConfig config, ReplySink sink) {
        VectorStoreDialect dialect = new PgVectorDialect(config.getStore().getSslMode());
        this.controlDataSource = ControlDatabase.open(config.getControlDb());
        this.registry = new JdbcTenantRegistry(controlDataSource,
                AesGcmSecretCipher.fromBase64(config.getEncryption().getKey()), config.getFallback());
        this.router = new VectorStoreRouter(registry, dialect,
                new HikariTenantDataSourceFactory(dialect, config.getStore().getPoolSize()),
                config.getEmbedding().getDimensions());
        registry.addListener(router);

        OkHttpClient httpClient = new OkHttpClient();
        EmbeddingSettings embeddingSettings = EmbeddingSettings.from(config.getEmbedding());
        EmbeddingProvider provider = EmbeddingProviders.fromConfig(httpClient, config.getEmbedding());
        OnboardingValidator onboarding = new OnboardingValidator(registry, router,
                new JdbcStoreProbe(dialect, config.getStore().getProbeTimeoutSeconds()),
                new EmbeddingKeyProbe(provider, embeddingSettings));

        JdbcUploadedFileRepository files = new JdbcUploadedFileRepository(controlDataSource);
        FileSystemBlobStorage blobs = new FileSystemBlobStorage(Path.of(config.getStorage().getUploadsDir()));
        this.coordinator = new IngestionCoordinator(registry, files, blobs, DocumentParsers.defaults(),
                new Segmenter(SegmenterSettings.from(config.getSegmenter())),
                new EmbeddingClient(provider, embeddingSettings), router,
                UploadPolicy.from(config.getIngestion()),
                Executors.newFixedThreadPool(config.getIngestion().getWorkers(), workerThreads()));
        this.exportBuilder = new ExportBuilder(files, blobs, router, JsonMapper.builder().findAndAddModules().build());
        this.dispatcher = new ChatCommandDispatcher(registry, onboarding, coordinator, exportBuilder, router, sink,
                config.getIngestion().getHistorySize());
        log.info("embedbot.started model={} dimensions={} workers={} fallback={}",
                embeddingSettings.model(), embeddingSettings.dimensions(), config.getIngestion().getWorkers(),
                config.getFallback().isEnabled());
    }

    public static Embedbot start(AppConfig config, ReplySink sink) {
        return new Embedbot(config, sink);
    }

    public JdbcTenantRegistry registry() {
        return registry;
    }

    public VectorStoreRouter router() {
        return router;
    }

    public IngestionCoordinator coordinator() {
        return coordinator;
    }

    public ExportBuilder exportBuilder() {
        return exportBuilder;
    }

    public ChatCommandDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        coordinator.close();
        router.close();
        controlDataSource.close();
        log.info("embedbot.stopped");
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
