package com.docstream.api.validation;

/**
 * The uploaded file or the requested parser is structurally invalid. No job is created.
 */
public class DocumentValidationException extends RuntimeException {

    public DocumentValidationException(String message) {
        super(message);
    }
}
