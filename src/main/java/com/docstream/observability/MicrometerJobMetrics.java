package com.docstream.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed metrics, exposed through the actuator metrics endpoint.
 *
 * Metrics:
 * - docstream.job.submitted: jobs accepted at ingestion, by parser
 * - docstream.job.duration: claim-to-terminal time, by parser and outcome
 * - docstream.queue.stale_redelivery: redeliveries of already finalized jobs that were skipped
 * - docstream.queue.superseded_claim: claims that lost ownership to a newer claim
 * - docstream.queue.redelivery: entries delivered more than once
 * - docstream.queue.force_finalized: entries that ran out of delivery attempts
 * - docstream.provider.latency: summarizer / AI parser call latency, by model, task and result
 * - docstream.provider.retry: provider call retries, by model and task
 */
@Service
public class MicrometerJobMetrics implements JobMetrics {

    private final MeterRegistry meterRegistry;

    public MicrometerJobMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordJobSubmitted(String parser) {
        Counter.builder("docstream.job.submitted")
                .description("Number of jobs accepted at ingestion")
                .tag("parser", parser)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordJobFinalized(String parser, String outcome, long durationMs) {
        Timer.builder("docstream.job.duration")
                .description("Time from claim to terminal write")
                .tag("parser", parser)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordStaleRedelivery() {
        meterRegistry.counter("docstream.queue.stale_redelivery").increment();
    }

    @Override
    public void recordSupersededClaim() {
        meterRegistry.counter("docstream.queue.superseded_claim").increment();
    }

    @Override
    public void recordRedelivery() {
        meterRegistry.counter("docstream.queue.redelivery").increment();
    }

    @Override
    public void recordForceFinalized() {
        meterRegistry.counter("docstream.queue.force_finalized").increment();
    }

    @Override
    public void recordProviderCall(long durationMs, String model, String taskType, boolean success) {
        Timer.builder("docstream.provider.latency")
                .description("External provider call latency")
                .tag("model", model)
                .tag("task_type", taskType)
                .tag("result", success ? "success" : "failure")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordProviderRetry(int attempt, String model, String taskType) {
        Counter.builder("docstream.provider.retry")
                .tag("model", model)
                .tag("task_type", taskType)
                .register(meterRegistry)
                .increment();
    }
}
