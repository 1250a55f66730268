package com.docstream.jobs;

import com.docstream.shared.dto.JobStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Client-side convenience that polls job status until it is terminal or the attempt ceiling is hit.
 * Holds no state between calls.
 */
@Component
public class JobStatusPoller {

    private static final Logger logger = LoggerFactory.getLogger(JobStatusPoller.class);

    private final JobQueryService jobQueryService;

    public JobStatusPoller(JobQueryService jobQueryService) {
        this.jobQueryService = jobQueryService;
    }

    public PollResult pollUntilTerminal(UUID jobUuid, long intervalMs, int maxAttempts) {
        return pollAllUntilTerminal(Set.of(jobUuid), intervalMs, maxAttempts).get(jobUuid);
    }

    /**
     * Polls every job round-robin. Each job gets at most {@code maxAttempts} status reads;
     * the loop sleeps {@code intervalMs} between rounds. Results keep the input order.
     */
    public Map<UUID, PollResult> pollAllUntilTerminal(Collection<UUID> jobUuids, long intervalMs, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Map<UUID, PollResult> results = new LinkedHashMap<>();
        Set<UUID> open = new LinkedHashSet<>(jobUuids);
        Map<UUID, JobStatusResponse> lastSeen = new LinkedHashMap<>();
        for (UUID jobUuid : jobUuids) {
            results.put(jobUuid, null);
        }

        for (int attempt = 1; attempt <= maxAttempts && !open.isEmpty(); attempt++) {
            for (UUID jobUuid : new LinkedHashSet<>(open)) {
                Optional<JobStatusResponse> snapshot = jobQueryService.findStatus(jobUuid);
                if (snapshot.isEmpty()) {
                    results.put(jobUuid, PollResult.notFound());
                    open.remove(jobUuid);
                } else if (snapshot.get().isTerminal()) {
                    results.put(jobUuid, PollResult.terminal(snapshot.get(), attempt));
                    open.remove(jobUuid);
                } else {
                    lastSeen.put(jobUuid, snapshot.get());
                }
            }
            if (!open.isEmpty() && attempt < maxAttempts) {
                if (!sleep(intervalMs)) {
                    break;
                }
            }
        }

        for (UUID jobUuid : open) {
            logger.warn("Polling gave up on job {} after {} attempts", jobUuid, maxAttempts);
            results.put(jobUuid, PollResult.timedOut(lastSeen.get(jobUuid), maxAttempts));
        }
        return results;
    }

    /**
     * Returns false when interrupted; the interrupt flag is restored.
     */
    protected boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public enum Outcome {
        TERMINAL,
        TIMED_OUT,
        NOT_FOUND
    }

    public static final class PollResult {
        private final Outcome outcome;
        private final JobStatusResponse snapshot;
        private final int attempts;

        private PollResult(Outcome outcome, JobStatusResponse snapshot, int attempts) {
            this.outcome = outcome;
            this.snapshot = snapshot;
            this.attempts = attempts;
        }

        static PollResult terminal(JobStatusResponse snapshot, int attempts) {
            return new PollResult(Outcome.TERMINAL, snapshot, attempts);
        }

        static PollResult timedOut(JobStatusResponse lastSnapshot, int attempts) {
            return new PollResult(Outcome.TIMED_OUT, lastSnapshot, attempts);
        }

        static PollResult notFound() {
            return new PollResult(Outcome.NOT_FOUND, null, 0);
        }

        public Outcome getOutcome() {
            return outcome;
        }

        /**
         * Terminal snapshot, or the last non-terminal one seen on timeout. Null when not found.
         */
        public JobStatusResponse getSnapshot() {
            return snapshot;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
