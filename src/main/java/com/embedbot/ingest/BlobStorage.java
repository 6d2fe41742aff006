package com.embedbot.ingest;

import java.io.IOException;

/**
 * Keeps the original bytes of uploaded files. Keys are opaque to callers.
 */
public interface BlobStorage {

    String store(long chatId, String fileName, byte[] content) throws IOException;

    byte[] load(String key) throws IOException;

    boolean exists(String key);
}
