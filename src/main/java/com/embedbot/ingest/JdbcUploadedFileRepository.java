package com.embedbot.ingest;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import com.embedbot.runtime.PersistenceException;

/**
 * Uploaded file rows in the control database. Every lookup is scoped to the owning tenant.
 */
public class JdbcUploadedFileRepository {
    private static final int MAX_ERROR_LENGTH = 2048;
    private static final String COLUMNS =
            "id, tenant_id, file_name, size_bytes, storage_key, status, error_message, uploaded_at, processed_at";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcUploadedFileRepository(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    JdbcUploadedFileRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public UploadedFile insert(long tenantId, String fileName, long sizeBytes, String storageKey) {
        OffsetDateTime now = now();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement insert = connection.prepareStatement(
                        "INSERT INTO uploaded_files (tenant_id, file_name, size_bytes, storage_key, status, uploaded_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?)",
                        new String[] {"id"})) {
            insert.setLong(1, tenantId);
            insert.setString(2, fileName);
            insert.setLong(3, sizeBytes);
            insert.setString(4, storageKey);
            insert.setString(5, FileStatus.PENDING.code());
            insert.setObject(6, now);
            insert.executeUpdate();
            try (ResultSet keys = insert.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated id returned for uploaded file");
                }
                return new UploadedFile(keys.getLong(1), tenantId, fileName, sizeBytes, storageKey,
                        FileStatus.PENDING, null, now, null);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to record upload of " + fileName, e);
        }
    }

    public Optional<UploadedFile> find(long tenantId, long fileId) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = connection.prepareStatement(
                        "SELECT " + COLUMNS + " FROM uploaded_files WHERE id = ? AND tenant_id = ?")) {
            select.setLong(1, fileId);
            select.setLong(2, tenantId);
            try (ResultSet rows = select.executeQuery()) {
                return rows.next() ? Optional.of(map(rows)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to read uploaded file " + fileId, e);
        }
    }

    /**
     * Newest uploads first.
     */
    public List<UploadedFile> recent(long tenantId, int limit) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = connection.prepareStatement(
                        "SELECT " + COLUMNS + " FROM uploaded_files WHERE tenant_id = ? "
                                + "ORDER BY uploaded_at DESC, id DESC")) {
            select.setLong(1, tenantId);
            select.setMaxRows(limit);
            List<UploadedFile> files = new ArrayList<>();
            try (ResultSet rows = select.executeQuery()) {
                while (rows.next()) {
                    files.add(map(rows));
                }
            }
            return files;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to list uploads of tenant " + tenantId, e);
        }
    }

    /**
     * Moves a file into a processing stage, clearing any previous error.
     */
    public void markStage(long fileId, FileStatus status) {
        update(fileId, status, null, null);
    }

    public void markStored(long fileId) {
        update(fileId, FileStatus.STORED, null, now());
    }

    public void markFailed(long fileId, String reason) {
        String message = reason == null ? "Unknown error" : reason;
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        update(fileId, FileStatus.FAILED, message, now());
    }

    public void markExported(long fileId) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement update = connection.prepareStatement(
                        "UPDATE uploaded_files SET status = ? WHERE id = ?")) {
            update.setString(1, FileStatus.EXPORTED.code());
            update.setLong(2, fileId);
            update.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Unable to mark uploaded file " + fileId + " exported", e);
        }
    }

    private void update(long fileId, FileStatus status, String errorMessage, OffsetDateTime processedAt) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement update = connection.prepareStatement(
                        "UPDATE uploaded_files SET status = ?, error_message = ?, processed_at = ? WHERE id = ?")) {
            update.setString(1, status.code());
            update.setString(2, errorMessage);
            if (processedAt == null) {
                update.setNull(3, Types.TIMESTAMP_WITH_TIMEZONE);
            } else {
                update.setObject(3, processedAt);
            }
            update.setLong(4, fileId);
            update.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Unable to update status of uploaded file " + fileId, e);
        }
    }

    private static UploadedFile map(ResultSet rows) throws SQLException {
        return new UploadedFile(
                rows.getLong("id"),
                rows.getLong("tenant_id"),
                rows.getString("file_name"),
                rows.getLong("size_bytes"),
                rows.getString("storage_key"),
                FileStatus.fromCode(rows.getString("status")),
                rows.getString("error_message"),
                rows.getObject("uploaded_at", OffsetDateTime.class),
                rows.getObject("processed_at", OffsetDateTime.class));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
