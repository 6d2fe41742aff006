package com.embedbot.ingest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedbot.tenant.Tenant;
import com.embedbot.vectorstore.StoredSegment;
import com.embedbot.vectorstore.VectorStoreRouter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Packs a stored file into a zip: the original upload under {@code original/} and every
 * stored segment with its vector, in stored order, in {@code segments.json}.
 */
public class ExportBuilder {
    private static final Logger log = LoggerFactory.getLogger(ExportBuilder.class);
    static final String SEGMENTS_ENTRY = "segments.json";
    static final String ORIGINAL_PREFIX = "original/";

    private final JdbcUploadedFileRepository files;
    private final BlobStorage blobs;
    private final VectorStoreRouter router;
    private final ObjectMapper mapper;

    public ExportBuilder(JdbcUploadedFileRepository files, BlobStorage blobs, VectorStoreRouter router,
            ObjectMapper mapper) {
        this.files = files;
        this.blobs = blobs;
        this.router = router;
        this.mapper = mapper;
    }

    /**
     * @throws ExportNotFoundException when the file is unknown for this tenant or has no stored segments
     */
    public ExportArchive export(Tenant tenant, long fileId) throws IOException {
        UploadedFile file = files.find(tenant.id(), fileId)
                .orElseThrow(() -> new ExportNotFoundException("File " + fileId + " was not found."));
        if (!file.status().hasStoredSegments()) {
            throw new ExportNotFoundException("File " + fileId + " has not been processed (status: "
                    + file.status().code() + ").");
        }
        List<StoredSegment> segments = router.read(tenant, fileId);
        if (segments.isEmpty()) {
            throw new ExportNotFoundException("No stored segments were found for file " + fileId + ".");
        }

        List<ExportedSegment> exported = new ArrayList<>(segments.size());
        for (StoredSegment segment : segments) {
            exported.add(new ExportedSegment(segment.id(), segment.title(), segment.body(), segment.vector()));
        }
        ExportDocument document = new ExportDocument(file.id(), file.fileName(), FileStatus.EXPORTED.code(), exported);

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            zip.putNextEntry(new ZipEntry(ORIGINAL_PREFIX + FileSystemBlobStorage.safeName(file.fileName())));
            zip.write(blobs.load(file.storageKey()));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry(SEGMENTS_ENTRY));
            zip.write(mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
            zip.closeEntry();
        }
        files.markExported(fileId);
        log.info("export.built tenantId={} fileId={} segments={} bytes={}", tenant.id(), fileId, segments.size(),
                buffer.size());
        return new ExportArchive(exportName(file), buffer.toByteArray());
    }

    static String exportName(UploadedFile file) {
        String safe = FileSystemBlobStorage.safeName(file.fileName());
        int dot = safe.lastIndexOf('.');
        String base = dot > 0 ? safe.substring(0, dot) : safe;
        return base + "_" + file.id() + "_export.zip";
    }

    record ExportDocument(
            @JsonProperty("file_id") long fileId,
            @JsonProperty("file_name") String fileName,
            @JsonProperty("status") String status,
            @JsonProperty("segments") List<ExportedSegment> segments) {
    }

    record ExportedSegment(
            @JsonProperty("id") long id,
            @JsonProperty("title") String title,
            @JsonProperty("body") String body,
            @JsonProperty("vector") float[] vector) {
    }
}
