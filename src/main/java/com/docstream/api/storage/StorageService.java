package com.docstream.api.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Storage for uploaded source documents (local filesystem or GCS).
 * The returned location travels inside the queue entry and is resolved again by the worker.
 */
public interface StorageService {

    /**
     * Stores a source document under {jobId}/{filename}.
     *
     * @return storage location (local://... or gs://...)
     */
    String uploadFile(UUID jobId, String filename, InputStream content, String contentType) throws IOException;

    byte[] downloadFile(String storageLocation) throws IOException;

    /**
     * Deletes a stored document. Returns false when nothing was stored at the location.
     */
    boolean deleteFile(String storageLocation) throws IOException;
}
