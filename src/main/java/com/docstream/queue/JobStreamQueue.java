package com.docstream.queue;

import com.docstream.shared.error.InfrastructureException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Durable job queue: one append-only stream consumed through one named consumer group.
 * Delivery is at-least-once; every delivered entry has exactly one owner until it is
 * acknowledged or its claim goes stale and is reclaimed.
 */
@Service
public class JobStreamQueue {

    private static final Logger logger = LoggerFactory.getLogger(JobStreamQueue.class);

    private final ConsumerGroupClaimService claimService;
    private final String streamName;
    private final String groupName;
    private final long pollIntervalMs;
    private volatile boolean initialized;

    public JobStreamQueue(ConsumerGroupClaimService claimService,
                          @Value("${app.queue.stream-name:pdf_jobs}") String streamName,
                          @Value("${app.queue.group-name:pdf_group}") String groupName,
                          @Value("${app.queue.poll-interval-ms:250}") long pollIntervalMs) {
        this.claimService = claimService;
        this.streamName = streamName;
        this.groupName = groupName;
        this.pollIntervalMs = pollIntervalMs;
    }

    @PostConstruct
    public void initialize() {
        try {
            ensureInitialized();
        } catch (DataAccessException e) {
            // Retried on first append or claim.
            logger.error("Failed to initialize stream '{}' / group '{}'", streamName, groupName, e);
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            claimService.ensureStreamGroup(streamName, groupName);
            initialized = true;
        }
    }

    public long append(UUID jobUuid, String parser, String sourceLocation) {
        try {
            ensureInitialized();
            return claimService.append(streamName, jobUuid, parser, sourceLocation);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to append job " + jobUuid + " to the queue", e);
        }
    }

    /**
     * Claims the next entry for {@code consumerId}, waiting up to {@code blockTimeout} for one to arrive.
     * Returns empty when nothing arrived in time or the calling thread was interrupted.
     */
    public Optional<ClaimedEntry> claimNext(String consumerId, Duration blockTimeout) {
        ensureInitialized();
        long deadline = System.nanoTime() + blockTimeout.toNanos();
        while (true) {
            Optional<ClaimedEntry> claimed = claimService.claimNext(streamName, groupName, consumerId);
            if (claimed.isPresent()) {
                return claimed;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(pollIntervalMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    /**
     * Returns false when the claim had already been superseded; the entry then belongs to another consumer.
     */
    public boolean acknowledge(ClaimedEntry claimed) {
        boolean acknowledged = claimService.acknowledge(streamName, groupName, claimed);
        if (acknowledged) {
            logger.debug("Acknowledged entry {} (job {})", claimed.getPosition(), claimed.getJobUuid());
        } else {
            logger.warn("Acknowledgment of entry {} by {} (attempt {}) matched no ownership record; claim was superseded",
                    claimed.getPosition(), claimed.getConsumerId(), claimed.getDeliveryAttempt());
        }
        return acknowledged;
    }

    public QueueMetrics metrics() {
        return claimService.snapshot(streamName, groupName);
    }

    /**
     * True when the backing store answers and the stream and group exist.
     */
    public boolean isConnected() {
        try {
            claimService.snapshot(streamName, groupName);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Queue connectivity check failed: {}", e.getMessage());
            return false;
        }
    }

    public String getStreamName() {
        return streamName;
    }

    public String getGroupName() {
        return groupName;
    }
}
