package com.docstream.processing;

import com.docstream.jobs.JobStateStore;
import com.docstream.observability.JobMetrics;
import com.docstream.shared.model.PendingEntry;
import com.docstream.shared.repository.ConsumerGroupRepository;
import com.docstream.shared.repository.PendingEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Scheduled service that recovers entries whose claim outlived the visibility timeout.
 * Claims with attempts left are released so any group member can reclaim them; claims that used up
 * the maximum delivery attempts are force-finalized as job errors and acknowledged.
 */
@Service
@ConditionalOnProperty(prefix = "docstream.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PendingEntryReaper {

    private static final Logger logger = LoggerFactory.getLogger(PendingEntryReaper.class);

    private final PendingEntryRepository pendingEntryRepository;
    private final ConsumerGroupRepository consumerGroupRepository;
    private final JobStateStore jobStateStore;
    private final JobMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final String streamName;
    private final String groupName;
    private final long visibilityTimeoutSeconds;
    private final int maxDeliveryAttempts;
    private final int batchSize;

    public PendingEntryReaper(PendingEntryRepository pendingEntryRepository,
                              ConsumerGroupRepository consumerGroupRepository,
                              JobStateStore jobStateStore,
                              JobMetrics metrics,
                              PlatformTransactionManager transactionManager,
                              @Value("${app.queue.stream-name:pdf_jobs}") String streamName,
                              @Value("${app.queue.group-name:pdf_group}") String groupName,
                              @Value("${app.queue.visibility-timeout-seconds:300}") long visibilityTimeoutSeconds,
                              @Value("${app.queue.max-delivery-attempts:3}") int maxDeliveryAttempts,
                              @Value("${app.queue.reaper-batch-size:50}") int batchSize) {
        this.pendingEntryRepository = pendingEntryRepository;
        this.consumerGroupRepository = consumerGroupRepository;
        this.jobStateStore = jobStateStore;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.streamName = streamName;
        this.groupName = groupName;
        this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
        this.batchSize = batchSize;
    }

    /**
     * Each stale claim is handled in its own transaction, so a failure on one row rolls back that row only.
     */
    @Scheduled(fixedDelayString = "${app.queue.reaper-interval-ms:15000}")
    public void reapStaleClaims() {
        List<Long> staleIds;
        Instant cutoff;
        try {
            Optional<Long> groupId = consumerGroupRepository.findIdByName(streamName, groupName);
            if (groupId.isEmpty()) {
                return;
            }
            cutoff = Instant.now().minusSeconds(visibilityTimeoutSeconds);
            staleIds = pendingEntryRepository.findStaleClaimIds(groupId.get(), cutoff, batchSize);
        } catch (Exception e) {
            logger.error("Error during stale claim reaping", e);
            return;
        }
        if (staleIds.isEmpty()) {
            return;
        }

        logger.info("Found {} claim(s) older than the {}s visibility timeout", staleIds.size(), visibilityTimeoutSeconds);

        Instant staleBefore = cutoff;
        for (Long id : staleIds) {
            try {
                transactionTemplate.executeWithoutResult(status ->
                        pendingEntryRepository.findStaleClaimForUpdate(id, staleBefore).ifPresent(this::reap));
            } catch (Exception e) {
                logger.error("Error reaping stale claim {}; continuing with the rest of the batch", id, e);
            }
        }
    }

    private void reap(PendingEntry claim) {
        if (claim.getDeliveryAttempts() >= maxDeliveryAttempts) {
            String message = "Job processing did not complete after " + claim.getDeliveryAttempts()
                    + " delivery attempts (last held by " + claim.getConsumerId() + ")";
            jobStateStore.forceError(claim.getJobUuid(), message);
            pendingEntryRepository.delete(claim);
            metrics.recordForceFinalized();
            logger.warn("Entry {} (job {}) exhausted {}/{} delivery attempts; force-finalized and acknowledged",
                    claim.getEntryPosition(), claim.getJobUuid(), claim.getDeliveryAttempts(), maxDeliveryAttempts);
        } else {
            String previousOwner = claim.getConsumerId();
            claim.release();
            logger.info("Released stale claim on entry {} (job {}) held by {} (attempt {}/{})",
                    claim.getEntryPosition(), claim.getJobUuid(), previousOwner,
                    claim.getDeliveryAttempts(), maxDeliveryAttempts);
        }
    }
}
