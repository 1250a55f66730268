package com.docstream.processing;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface for the Gemini client to support both real and stub implementations.
 */
public interface GeminiServiceInterface {
    String generateContent(String prompt, String taskType) throws IOException, TimeoutException;
    String generateContent(String prompt, byte[] pdfBytes, String taskType) throws IOException, TimeoutException;
    boolean isAvailable();
    String getModel();
}
