package com.docstream.processing;

import com.docstream.api.storage.StorageService;
import com.docstream.jobs.JobStateStore;
import com.docstream.shared.repository.ConsumerGroupRepository;
import com.docstream.shared.repository.StreamEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Scheduled task that enforces the job TTL physically and trims the acknowledged tail of the stream.
 * Reads already treat expired jobs as absent; this task reclaims their rows and source files.
 * Only loads when docstream.worker.enabled=true.
 */
@Service
@ConditionalOnProperty(prefix = "docstream.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobRetentionTask {

    private static final Logger logger = LoggerFactory.getLogger(JobRetentionTask.class);

    private final JobStateStore jobStateStore;
    private final StreamEntryRepository streamEntryRepository;
    private final ConsumerGroupRepository consumerGroupRepository;
    private final StorageService storageService;
    private final String streamName;

    public JobRetentionTask(JobStateStore jobStateStore,
                            StreamEntryRepository streamEntryRepository,
                            ConsumerGroupRepository consumerGroupRepository,
                            StorageService storageService,
                            @Value("${app.queue.stream-name:pdf_jobs}") String streamName) {
        this.jobStateStore = jobStateStore;
        this.streamEntryRepository = streamEntryRepository;
        this.consumerGroupRepository = consumerGroupRepository;
        this.storageService = storageService;
        this.streamName = streamName;
        logger.info("JobRetentionTask initialized: ttlSeconds={}", jobStateStore.getTtl().getSeconds());
    }

    @Scheduled(fixedDelayString = "${app.job.purge-interval-ms:600000}")
    @Transactional
    public void purgeExpired() {
        Instant now = Instant.now();
        try {
            List<String> sources = jobStateStore.findExpiredSourceLocations(now);
            for (String location : sources) {
                deleteSourceQuietly(location);
            }

            int deletedJobs = jobStateStore.purgeExpired(now);
            if (deletedJobs > 0) {
                logger.info("Purged {} expired job record(s)", deletedJobs);
            }

            Long slowestCursor = consumerGroupRepository.findSlowestCursor(streamName);
            if (slowestCursor != null && slowestCursor > 0) {
                Instant appendedBefore = now.minus(jobStateStore.getTtl());
                int trimmed = streamEntryRepository.trimAcknowledged(streamName, slowestCursor, appendedBefore);
                if (trimmed > 0) {
                    logger.info("Trimmed {} acknowledged entries from stream '{}'", trimmed, streamName);
                }
            }
        } catch (Exception e) {
            logger.error("Error during retention cleanup", e);
        }
    }

    private void deleteSourceQuietly(String location) {
        if (location == null) {
            return;
        }
        try {
            storageService.deleteFile(location);
        } catch (IOException | RuntimeException e) {
            logger.debug("Source {} already gone or not deletable: {}", location, e.getMessage());
        }
    }
}
