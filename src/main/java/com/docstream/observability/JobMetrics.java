package com.docstream.observability;

/**
 * Metrics emitted by ingestion, the worker pool and the provider client.
 */
public interface JobMetrics {
    void recordJobSubmitted(String parser);
    void recordJobFinalized(String parser, String outcome, long durationMs);
    void recordStaleRedelivery();
    void recordSupersededClaim();
    void recordRedelivery();
    void recordForceFinalized();
    void recordProviderCall(long durationMs, String model, String taskType, boolean success);
    void recordProviderRetry(int attempt, String model, String taskType);
}
