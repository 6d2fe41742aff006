package com.embedbot.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stores blobs under {@code <root>/<chatId>/<yyyyMMdd>_<uuid>_<name>}. Keys are paths relative
 * to the root.
 */
public class FileSystemBlobStorage implements BlobStorage {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^\\p{L}\\p{N}._-]+");

    private final Path root;
    private final Clock clock;

    public FileSystemBlobStorage(Path root) {
        this(root, Clock.systemUTC());
    }

    FileSystemBlobStorage(Path root, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public String store(long chatId, String fileName, byte[] content) throws IOException {
        String name = LocalDate.now(clock).format(DAY) + "_" + UUID.randomUUID() + "_" + safeName(fileName);
        Path relative = Path.of(Long.toString(chatId), name);
        Path target = resolve(relative.toString());
        Files.createDirectories(target.getParent());
        Files.write(target, content);
        return relative.toString().replace('\\', '/');
    }

    @Override
    public byte[] load(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(key);
        }
        return Files.readAllBytes(path);
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    static String safeName(String fileName) {
        String base = fileName == null ? "" : Path.of(fileName).getFileName().toString();
        String safe = UNSAFE_NAME_CHARS.matcher(base).replaceAll("_");
        return safe.isBlank() ? "upload" : safe;
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Blob key escapes storage root: " + key);
        }
        return path;
    }
}
