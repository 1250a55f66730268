package com.docstream.processing;

import com.docstream.queue.ClaimedEntry;
import com.docstream.queue.JobStreamQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of stream consumers. Each thread is an independent group member with its own consumer id;
 * the threads share no state beyond the queue and the job store.
 * Only loads when docstream.worker.enabled=true.
 */
@Service
@ConditionalOnProperty(prefix = "docstream.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(StreamWorkerPool.class);
    private static final long ERROR_BACKOFF_MS = 1000L;

    private final JobStreamQueue jobStreamQueue;
    private final JobProcessor jobProcessor;
    private final int concurrency;
    private final Duration blockTimeout;
    private final long shutdownGraceSeconds;
    private final List<String> consumerIds = new ArrayList<>();

    private ExecutorService executor;
    private volatile boolean running;

    public StreamWorkerPool(JobStreamQueue jobStreamQueue,
                            JobProcessor jobProcessor,
                            @Value("${docstream.worker.concurrency:2}") int concurrency,
                            @Value("${app.queue.block-timeout-ms:5000}") long blockTimeoutMs,
                            @Value("${docstream.worker.shutdown-grace-seconds:20}") long shutdownGraceSeconds) {
        this.jobStreamQueue = jobStreamQueue;
        this.jobProcessor = jobProcessor;
        this.concurrency = Math.max(1, concurrency);
        this.blockTimeout = Duration.ofMillis(blockTimeoutMs);
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "stream-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        });

        String instanceId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        for (int i = 1; i <= concurrency; i++) {
            String consumerId = "worker-" + instanceId + "-" + i;
            consumerIds.add(consumerId);
            executor.submit(() -> runLoop(consumerId));
        }
        logger.info("Started {} stream consumer(s) on stream '{}' group '{}': {}",
                concurrency, jobStreamQueue.getStreamName(), jobStreamQueue.getGroupName(), consumerIds);
    }

    void runLoop(String consumerId) {
        logger.info("Consumer {} started", consumerId);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<ClaimedEntry> claimed = jobStreamQueue.claimNext(consumerId, blockTimeout);
                claimed.ifPresent(jobProcessor::process);
            } catch (Throwable e) {
                logger.error("Consumer {} failed on the current entry; retrying in {}ms",
                        consumerId, ERROR_BACKOFF_MS, e);
                pause();
            }
        }
        logger.info("Consumer {} stopped", consumerId);
    }

    private void pause() {
        try {
            Thread.sleep(ERROR_BACKOFF_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops claiming and waits for in-flight jobs. Entries still unfinished after the grace period
     * stay claimed and are recovered by the reaper once their visibility timeout expires.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                logger.warn("Consumers did not finish within {}s; interrupting", shutdownGraceSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Stream worker pool stopped");
    }

    public List<String> getConsumerIds() {
        return Collections.unmodifiableList(consumerIds);
    }

    public boolean isRunning() {
        return running;
    }
}
