package com.docstream.jobs;

import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;
import com.docstream.shared.model.PageMarkdown;
import com.docstream.shared.repository.DocumentJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyed store of job records with TTL. Every mutation is a read-modify-write under a row lock,
 * which makes the worker's fencing check atomic with the write it guards.
 */
@Service
public class JobStateStore {

    private static final Logger logger = LoggerFactory.getLogger(JobStateStore.class);

    private final DocumentJobRepository documentJobRepository;
    private final Duration ttl;

    public JobStateStore(DocumentJobRepository documentJobRepository,
                         @Value("${app.job.ttl-seconds:86400}") long ttlSeconds) {
        this.documentJobRepository = documentJobRepository;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @Transactional
    public DocumentJob createPending(UUID jobUuid, String parser, String filename,
                                     String sourceLocation, long fileSizeBytes) {
        DocumentJob job = new DocumentJob(jobUuid, parser);
        job.setFilename(filename);
        job.setSourceLocation(sourceLocation);
        job.setFileSizeBytes(fileSizeBytes);
        DocumentJob saved = documentJobRepository.save(job);
        logger.info("Job record created: jobId={}, parser={}", jobUuid, parser);
        return saved;
    }

    /**
     * Live record for the job. Records past their TTL are treated as absent.
     */
    @Transactional(readOnly = true)
    public Optional<DocumentJob> find(UUID jobUuid) {
        Instant now = Instant.now();
        return documentJobRepository.findByJobUuid(jobUuid)
                .filter(job -> !job.isExpired(now));
    }

    /**
     * Fencing check plus the transition to PROCESSING, in one locked read-modify-write.
     */
    @Transactional
    public ClaimDecision beginProcessing(UUID jobUuid, String consumerId, int attempt) {
        Instant now = Instant.now();
        Optional<DocumentJob> locked = documentJobRepository.findByJobUuidForUpdate(jobUuid);
        if (locked.isEmpty() || locked.get().isExpired(now)) {
            return ClaimDecision.MISSING;
        }

        DocumentJob job = locked.get();
        if (job.getStatus().isTerminal()) {
            return ClaimDecision.ALREADY_FINALIZED;
        }
        if (job.getStatus() == JobStatus.PROCESSING && !job.isSupersededBy(attempt)) {
            logger.warn("Job {} is held by {} (attempt {}); claim attempt {} by {} is stale",
                    jobUuid, job.getOwnerConsumer(), job.getFenceToken(), attempt, consumerId);
            return ClaimDecision.SUPERSEDED;
        }

        if (job.getStatus() == JobStatus.PROCESSING) {
            logger.info("Job {} taken over from {} (attempt {}) by {} (attempt {})",
                    jobUuid, job.getOwnerConsumer(), job.getFenceToken(), consumerId, attempt);
        }
        job.markProcessing(consumerId, attempt, now);
        return ClaimDecision.PROCEED;
    }

    /**
     * Terminal success write. Returns false without writing when the claim no longer holds the job.
     */
    @Transactional
    public boolean finalizeDone(UUID jobUuid, String consumerId, int attempt,
                                List<PageMarkdown> pages, String summaryMd) {
        Optional<DocumentJob> held = lockIfHeld(jobUuid, consumerId, attempt);
        if (held.isEmpty()) {
            return false;
        }
        held.get().complete(pages, summaryMd, Instant.now(), ttl);
        logger.info("Job {} finalized as done ({} pages)", jobUuid, pages.size());
        return true;
    }

    /**
     * Terminal error write. Returns false without writing when the claim no longer holds the job.
     */
    @Transactional
    public boolean finalizeError(UUID jobUuid, String consumerId, int attempt, String errorMessage) {
        Optional<DocumentJob> held = lockIfHeld(jobUuid, consumerId, attempt);
        if (held.isEmpty()) {
            return false;
        }
        held.get().fail(errorMessage, Instant.now(), ttl);
        logger.info("Job {} finalized as error: {}", jobUuid, errorMessage);
        return true;
    }

    /**
     * Marks a job as error regardless of the current claim. Used when an entry ran out of delivery
     * attempts. A job that is already terminal is left as it is.
     */
    @Transactional
    public boolean forceError(UUID jobUuid, String errorMessage) {
        Optional<DocumentJob> locked = documentJobRepository.findByJobUuidForUpdate(jobUuid);
        if (locked.isEmpty() || locked.get().getStatus().isTerminal()) {
            return false;
        }
        locked.get().fail(errorMessage, Instant.now(), ttl);
        logger.warn("Job {} force-finalized as error: {}", jobUuid, errorMessage);
        return true;
    }

    @Transactional
    public int purgeExpired(Instant now) {
        return documentJobRepository.deleteExpired(now);
    }

    @Transactional(readOnly = true)
    public List<String> findExpiredSourceLocations(Instant now) {
        return documentJobRepository.findExpiredSourceLocations(now);
    }

    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : documentJobRepository.countLiveByStatus(Instant.now())) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    public Duration getTtl() {
        return ttl;
    }

    private Optional<DocumentJob> lockIfHeld(UUID jobUuid, String consumerId, int attempt) {
        Optional<DocumentJob> locked = documentJobRepository.findByJobUuidForUpdate(jobUuid);
        if (locked.isEmpty()) {
            logger.warn("Job {} disappeared before its terminal write", jobUuid);
            return Optional.empty();
        }
        DocumentJob job = locked.get();
        if (!job.isHeldBy(consumerId, attempt)) {
            logger.warn("Terminal write for job {} by {} (attempt {}) fenced off: status={}, owner={}, fence={}",
                    jobUuid, consumerId, attempt, job.getStatus(), job.getOwnerConsumer(), job.getFenceToken());
            return Optional.empty();
        }
        return locked;
    }
}
