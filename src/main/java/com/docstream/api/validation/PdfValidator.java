package com.docstream.api.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Cheap structural checks on an uploaded PDF: name, size bounds and the %PDF- header.
 * Runs before any job exists, so a rejected file leaves no trace.
 */
@Component
public class PdfValidator {

    private static final Logger logger = LoggerFactory.getLogger(PdfValidator.class);
    private static final byte[] PDF_MAGIC_BYTES = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    static final int MIN_FILE_SIZE_BYTES = 10;

    private final int maxUploadMb;

    public PdfValidator(@Value("${app.upload.max-mb:25}") int maxUploadMb) {
        this.maxUploadMb = maxUploadMb;
        logger.info("PdfValidator initialized: maxUploadMb={}", maxUploadMb);
    }

    /**
     * @throws DocumentValidationException describing the first failed check
     */
    public void validate(String filename, byte[] content) {
        if (filename == null || filename.isBlank()) {
            throw new DocumentValidationException("No filename provided");
        }
        if (!filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new DocumentValidationException("Only PDF files are supported: " + filename);
        }
        if (content == null || content.length == 0) {
            throw new DocumentValidationException("Empty file provided: " + filename);
        }

        long maxBytes = getMaxUploadBytes();
        if (content.length > maxBytes) {
            throw new DocumentValidationException(String.format(
                    "File too large: %.1fMB exceeds maximum of %dMB", content.length / (1024.0 * 1024.0), maxUploadMb));
        }
        if (content.length < MIN_FILE_SIZE_BYTES) {
            throw new DocumentValidationException("File too small to be a valid PDF: " + filename);
        }
        if (!hasPdfHeader(content)) {
            logger.warn("PDF validation failed for {}: missing %PDF- header", filename);
            throw new DocumentValidationException("File does not appear to be a valid PDF: " + filename);
        }
    }

    static boolean hasPdfHeader(byte[] content) {
        if (content.length < PDF_MAGIC_BYTES.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC_BYTES.length; i++) {
            if (content[i] != PDF_MAGIC_BYTES[i]) {
                return false;
            }
        }
        return true;
    }

    public long getMaxUploadBytes() {
        return maxUploadMb * 1024L * 1024L;
    }

    public int getMaxUploadMb() {
        return maxUploadMb;
    }
}
