package com.embedbot.ingest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;

import javax.sql.DataSource;

import com.embedbot.embedding.EmbeddingClient;
import com.embedbot.embedding.EmbeddingProvider;
import com.embedbot.embedding.EmbeddingSettings;
import com.embedbot.runtime.AppConfig;
import com.embedbot.runtime.H2Databases;
import com.embedbot.tenant.JdbcTenantRegistry;
import com.embedbot.tenant.TestCiphers;
import com.embedbot.vectorstore.H2VectorStoreDialect;
import com.embedbot.vectorstore.HikariTenantDataSourceFactory;
import com.embedbot.vectorstore.VectorStoreRouter;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Ingestion wired against in-memory H2 control and tenant databases.
 */
public final class IngestionFixture implements AutoCloseable {
    public static final int DIMENSIONS = 4;

    public final DataSource controlDb;
    public final JdbcTenantRegistry registry;
    public final VectorStoreRouter router;
    public final JdbcUploadedFileRepository files;
    public final FileSystemBlobStorage blobs;
    public final IngestionCoordinator coordinator;
    public final ExportBuilder exportBuilder;

    public IngestionFixture(Path uploadsDir, EmbeddingProvider provider) {
        controlDb = H2Databases.controlDatabase();
        registry = new JdbcTenantRegistry(controlDb, TestCiphers.aes(), new AppConfig.FallbackConfig());
        H2VectorStoreDialect dialect = H2VectorStoreDialect.standard();
        router = new VectorStoreRouter(registry, dialect, new HikariTenantDataSourceFactory(dialect, 2), DIMENSIONS);
        registry.addListener(router);
        files = new JdbcUploadedFileRepository(controlDb);
        blobs = new FileSystemBlobStorage(uploadsDir);
        EmbeddingSettings settings = new EmbeddingSettings("test-model", DIMENSIONS, 2, 2, Duration.ZERO,
                Duration.ZERO, Duration.ZERO);
        coordinator = new IngestionCoordinator(registry, files, blobs, DocumentParsers.defaults(),
                new Segmenter(new SegmenterSettings(3, 1000, 3, 0.5, Locale.ENGLISH)),
                new EmbeddingClient(provider, settings), router,
                new UploadPolicy(List.of(".txt", ".md", ".csv", ".docx"), 1024 * 1024),
                Executors.newFixedThreadPool(2));
        exportBuilder = new ExportBuilder(files, blobs, router, JsonMapper.builder().findAndAddModules().build());
    }

    @Override
    public void close() {
        coordinator.close();
        router.close();
    }
}
