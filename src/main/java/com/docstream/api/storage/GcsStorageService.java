package com.docstream.api.storage;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Stores source documents in Google Cloud Storage as gs://{bucket}/sources/{jobId}/{filename}.
 * Honors STORAGE_EMULATOR_HOST for local emulators.
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "gcs")
public class GcsStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(GcsStorageService.class);

    private final Storage storage;
    private final String bucketName;

    public GcsStorageService(@Value("${app.gcs.bucket-name:docstream-sources}") String bucketName) {
        this.bucketName = bucketName;
        this.storage = StorageOptions.getDefaultInstance().getService();
        logger.info("GCS storage initialized with bucket {}", bucketName);
    }

    @Override
    public String uploadFile(UUID jobId, String filename, InputStream content, String contentType) throws IOException {
        String objectName = "sources/" + jobId + "/" + LocalStorageService.sanitizeFilename(filename);
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucketName, objectName))
                .setContentType(contentType)
                .build();
        try {
            storage.createFrom(blobInfo, content);
        } catch (Exception e) {
            logger.error("Failed to upload file to GCS: gs://{}/{}", bucketName, objectName, e);
            throw new IOException("Failed to upload file to GCS", e);
        }
        String location = "gs://" + bucketName + "/" + objectName;
        logger.debug("Stored source document at {}", location);
        return location;
    }

    @Override
    public byte[] downloadFile(String storageLocation) throws IOException {
        BlobId blobId = toBlobId(storageLocation);
        try {
            return storage.readAllBytes(blobId);
        } catch (Exception e) {
            throw new IOException("Failed to download file from GCS: " + storageLocation, e);
        }
    }

    @Override
    public boolean deleteFile(String storageLocation) throws IOException {
        BlobId blobId = toBlobId(storageLocation);
        try {
            return storage.delete(blobId);
        } catch (Exception e) {
            throw new IOException("Failed to delete file from GCS: " + storageLocation, e);
        }
    }

    private BlobId toBlobId(String storageLocation) {
        String prefix = "gs://" + bucketName + "/";
        if (storageLocation == null || !storageLocation.startsWith(prefix)) {
            throw new IllegalArgumentException("Invalid GCS location for bucket " + bucketName + ": " + storageLocation);
        }
        return BlobId.of(bucketName, storageLocation.substring(prefix.length()));
    }
}
