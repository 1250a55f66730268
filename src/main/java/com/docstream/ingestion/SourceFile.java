package com.docstream.ingestion;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * An uploaded file held in memory for the duration of one request.
 */
public class SourceFile {

    private final String filename;
    private final byte[] content;

    public SourceFile(String filename, byte[] content) {
        this.filename = filename;
        this.content = content;
    }

    public static SourceFile from(MultipartFile file) throws IOException {
        return new SourceFile(file.getOriginalFilename(), file.getBytes());
    }

    public String getFilename() {
        return filename;
    }

    public byte[] getContent() {
        return content;
    }

    public long getSize() {
        return content != null ? content.length : 0;
    }
}
