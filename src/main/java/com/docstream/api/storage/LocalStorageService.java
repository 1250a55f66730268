package com.docstream.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores source documents on the local filesystem as local://sources/{jobId}/{filename}.
 * Only loads when app.storage.mode=local (or when the property is missing).
 */
@Service
@ConditionalOnProperty(name = "app.storage.mode", havingValue = "local", matchIfMissing = true)
public class LocalStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageService.class);
    private static final Pattern INVALID_FILENAME_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final String SCHEME = "local://";
    private static final String SOURCES_DIR = "sources";

    private final Path storageRoot;

    public LocalStorageService(@Value("${app.storage.local-dir:.local-storage}") String localDir) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(storageRoot);
            logger.info("Local storage initialized at {}", storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + storageRoot, e);
        }
    }

    static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "document.pdf";
        }
        String sanitized = INVALID_FILENAME_CHARS.matcher(filename).replaceAll("_");
        return sanitized.replace("..", "_");
    }

    @Override
    public String uploadFile(UUID jobId, String filename, InputStream content, String contentType) throws IOException {
        String safeName = sanitizeFilename(filename);
        Path jobDir = storageRoot.resolve(SOURCES_DIR).resolve(jobId.toString());
        Files.createDirectories(jobDir);
        Path target = jobDir.resolve(safeName);

        try {
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to write source document to {}", target, e);
            throw new IOException("Failed to store source document locally", e);
        }

        String location = SCHEME + SOURCES_DIR + "/" + jobId + "/" + safeName;
        logger.debug("Stored source document at {}", location);
        return location;
    }

    @Override
    public byte[] downloadFile(String storageLocation) throws IOException {
        Path path = resolve(storageLocation);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + storageLocation);
        }
        return Files.readAllBytes(path);
    }

    @Override
    public boolean deleteFile(String storageLocation) throws IOException {
        Path path = resolve(storageLocation);
        boolean deleted = Files.deleteIfExists(path);
        Path jobDir = path.getParent();
        if (jobDir != null && Files.isDirectory(jobDir)) {
            try (Stream<Path> remaining = Files.list(jobDir)) {
                if (remaining.findAny().isEmpty()) {
                    Files.delete(jobDir);
                }
            }
        }
        return deleted;
    }

    /**
     * Maps local://{subdir}/{jobId}/{filename} to a path, rejecting anything outside the storage root.
     */
    private Path resolve(String storageLocation) {
        if (storageLocation == null || !storageLocation.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Invalid local storage location: " + storageLocation);
        }
        String[] parts = storageLocation.substring(SCHEME.length()).split("/", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid local storage location format: " + storageLocation);
        }
        Path path = storageRoot.resolve(parts[0]).resolve(parts[1]).resolve(parts[2]).normalize();
        if (!path.startsWith(storageRoot)) {
            throw new IllegalArgumentException("Path traversal detected: " + storageLocation);
        }
        return path;
    }
}
