package com.docstream.processing;

import com.docstream.observability.JobMetrics;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client for the Gemini API using the Google Gen AI SDK.
 * Runs in stub mode when no API key is configured: text prompts get a deterministic response
 * and {@link #isAvailable()} reports false.
 *
 * <p>Calls are retried up to {@code maxRetryAttempts} times with exponential backoff starting at
 * {@code baseRetryDelayMs} and capped at {@link #MAX_RETRY_DELAY_MS}. Only timeouts, HTTP 429 and
 * HTTP 5xx are retried.
 */
@Service
public class GeminiService implements GeminiServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(GeminiService.class);
    private static final String DEFAULT_MODEL = "gemini-2.0-flash";
    private static final long MAX_RETRY_DELAY_MS = 10_000L;
    private static final Pattern HTTP_STATUS = Pattern.compile("\\bHTTP\\s+([1-5]\\d{2})\\b");

    private final boolean enabled;
    private final String model;
    private final int timeoutSeconds;
    private final int maxRetryAttempts;
    private final long baseRetryDelayMs;
    private final JobMetrics metrics;
    private Client client;

    public GeminiService(
            @Value("${app.gemini.api-key:}") String apiKey,
            @Value("${app.gemini.model:gemini-2.0-flash}") String model,
            @Value("${app.gemini.timeout-seconds:120}") int timeoutSeconds,
            @Value("${app.gemini.max-retry-attempts:3}") int maxRetryAttempts,
            @Value("${app.gemini.base-retry-delay-ms:1000}") long baseRetryDelayMs,
            @Autowired(required = false) JobMetrics metrics) {
        this.enabled = apiKey != null && !apiKey.isBlank();
        this.model = model != null && !model.isEmpty() ? model : DEFAULT_MODEL;
        this.timeoutSeconds = timeoutSeconds;
        this.maxRetryAttempts = Math.max(1, maxRetryAttempts);
        this.baseRetryDelayMs = baseRetryDelayMs;
        this.metrics = metrics; // May be null in unit tests

        logger.info("GeminiService initialized: enabled={}, model={}, timeoutSeconds={}, maxRetryAttempts={}",
                this.enabled, this.model, this.timeoutSeconds, this.maxRetryAttempts);

        if (this.enabled) {
            this.client = initializeClient(apiKey);
        } else {
            logger.info("No Gemini API key configured, using stub mode");
        }
    }

    private Client initializeClient(String apiKey) {
        try {
            Client clientInstance = Client.builder()
                    .apiKey(apiKey)
                    .httpOptions(HttpOptions.builder().timeout(timeoutSeconds * 1000).build())
                    .build();
            logger.info("Google Gen AI SDK client initialized");
            return clientInstance;
        } catch (Exception e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return enabled && client != null;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public String generateContent(String prompt, String taskType) throws IOException, TimeoutException {
        if (!isAvailable()) {
            logger.debug("Using stub mode for task {}", taskType);
            return generateStubResponse(prompt, taskType);
        }
        return generateWithRetry(prompt, null, taskType);
    }

    @Override
    public String generateContent(String prompt, byte[] pdfBytes, String taskType) throws IOException, TimeoutException {
        if (!isAvailable()) {
            throw new IOException("Gemini API is not configured");
        }
        return generateWithRetry(prompt, pdfBytes, taskType);
    }

    private String generateWithRetry(String prompt, byte[] pdfBytes, String taskType)
            throws IOException, TimeoutException {
        int attempt = 1;
        while (true) {
            long startTime = System.currentTimeMillis();
            try {
                String text = invokeModel(prompt, pdfBytes);
                if (text == null || text.isBlank()) {
                    throw new IOException("Gemini API returned empty or null response");
                }
                recordCall(startTime, taskType, true);
                logger.debug("Gemini call succeeded: taskType={}, attempt={}, responseLength={}",
                        taskType, attempt, text.length());
                return text;
            } catch (IOException | TimeoutException e) {
                recordCall(startTime, taskType, false);
                if (attempt >= maxRetryAttempts || !isRetryableError(e)) {
                    logger.error("Gemini call failed: taskType={}, attempt={}/{}: {}",
                            taskType, attempt, maxRetryAttempts, e.getMessage());
                    throw e;
                }
                long delayMs = computeBackoffDelay(attempt);
                logger.warn("Gemini call failed with retryable error (attempt {}/{}), retrying in {}ms: {}",
                        attempt, maxRetryAttempts, delayMs, e.getMessage());
                if (metrics != null) {
                    metrics.recordProviderRetry(attempt, model, taskType);
                }
                sleep(delayMs);
                attempt++;
            }
        }
    }

    /**
     * One SDK call. SDK exceptions are normalized to IOException, or TimeoutException when the
     * HTTP deadline was hit.
     */
    protected String invokeModel(String prompt, byte[] pdfBytes) throws IOException, TimeoutException {
        Content content = pdfBytes == null
                ? Content.fromParts(Part.fromText(prompt))
                : Content.fromParts(Part.fromText(prompt), Part.fromBytes(pdfBytes, "application/pdf"));
        try {
            GenerateContentResponse response = client.models.generateContent(model, content, null);
            return response.text();
        } catch (Exception e) {
            if (isTimeout(e)) {
                TimeoutException timeout = new TimeoutException("Gemini API call timed out after " + timeoutSeconds + "s");
                timeout.initCause(e);
                throw timeout;
            }
            ApiException apiError = findApiException(e);
            if (apiError != null) {
                throw new ProviderStatusException(apiError.code(),
                        "Gemini API call failed with HTTP " + apiError.code() + ": " + e.getMessage(), e);
            }
            throw new IOException("Gemini API call failed: " + e.getMessage(), e);
        }
    }

    private static ApiException findApiException(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ApiException) {
                return (ApiException) t;
            }
        }
        return null;
    }

    private boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedIOException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Timeouts, rate limiting (429) and server errors (5xx) are transient; everything else is not.
     */
    boolean isRetryableError(Throwable e) {
        if (e instanceof TimeoutException) {
            return true;
        }
        if (e instanceof ProviderStatusException) {
            return isRetryableStatus(((ProviderStatusException) e).getStatusCode());
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return true;
        }
        // Only the leading "HTTP nnn" counts; other numbers in the message (token counts) are not statuses.
        Matcher matcher = HTTP_STATUS.matcher(message);
        return matcher.find() && isRetryableStatus(Integer.parseInt(matcher.group(1)));
    }

    private static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }

    long computeBackoffDelay(int attempt) {
        long delay = baseRetryDelayMs * (1L << Math.min(attempt - 1, 20));
        return Math.min(delay, MAX_RETRY_DELAY_MS);
    }

    void sleep(long delayMs) throws IOException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry Gemini call", e);
        }
    }

    private void recordCall(long startTime, String taskType, boolean success) {
        if (metrics != null) {
            metrics.recordProviderCall(System.currentTimeMillis() - startTime, model, taskType, success);
        }
    }

    private String generateStubResponse(String prompt, String taskType) {
        // Deterministic so local runs and tests see stable output.
        if ("summary".equals(taskType)) {
            return "## Summary\n\n"
                    + "*Stub summary: no summarization provider is configured.*\n\n"
                    + "- Input length: " + prompt.length() + " characters\n";
        }
        return "stub_response";
    }

    /**
     * Provider failure that carries the HTTP status reported by the SDK.
     */
    static final class ProviderStatusException extends IOException {

        private final int statusCode;

        ProviderStatusException(int statusCode, String message, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        int getStatusCode() {
            return statusCode;
        }
    }
}
