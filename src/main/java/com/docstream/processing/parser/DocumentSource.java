package com.docstream.processing.parser;

import java.io.IOException;

/**
 * Source bytes of a document, read lazily. A strategy that never reads them causes no storage access.
 */
public interface DocumentSource {

    byte[] readBytes() throws IOException;

    static DocumentSource ofBytes(byte[] bytes) {
        return () -> bytes;
    }
}
