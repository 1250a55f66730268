package com.docstream.processing;

import com.docstream.api.storage.StorageService;
import com.docstream.processing.parser.DocumentSource;

import java.io.IOException;

/**
 * Reads the source document from storage on first access and keeps the bytes for later reads.
 */
class StoredDocumentSource implements DocumentSource {

    private final StorageService storageService;
    private final String location;
    private byte[] bytes;

    StoredDocumentSource(StorageService storageService, String location) {
        this.storageService = storageService;
        this.location = location;
    }

    @Override
    public byte[] readBytes() throws IOException {
        if (bytes == null) {
            bytes = storageService.downloadFile(location);
        }
        return bytes;
    }
}
