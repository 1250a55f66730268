package com.docstream.queue;

import com.docstream.shared.error.InfrastructureException;
import com.docstream.shared.model.ConsumerGroup;
import com.docstream.shared.model.JobStream;
import com.docstream.shared.model.PendingEntry;
import com.docstream.shared.model.StreamEntry;
import com.docstream.shared.repository.ConsumerGroupRepository;
import com.docstream.shared.repository.JobStreamRepository;
import com.docstream.shared.repository.PendingEntryRepository;
import com.docstream.shared.repository.StreamEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stream and consumer-group operations, each inside a single transaction.
 * This is a separate bean to avoid @Transactional self-invocation from {@link JobStreamQueue}.
 */
@Service
public class ConsumerGroupClaimService {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerGroupClaimService.class);

    private final JobStreamRepository jobStreamRepository;
    private final StreamEntryRepository streamEntryRepository;
    private final ConsumerGroupRepository consumerGroupRepository;
    private final PendingEntryRepository pendingEntryRepository;

    public ConsumerGroupClaimService(JobStreamRepository jobStreamRepository,
                                     StreamEntryRepository streamEntryRepository,
                                     ConsumerGroupRepository consumerGroupRepository,
                                     PendingEntryRepository pendingEntryRepository) {
        this.jobStreamRepository = jobStreamRepository;
        this.streamEntryRepository = streamEntryRepository;
        this.consumerGroupRepository = consumerGroupRepository;
        this.pendingEntryRepository = pendingEntryRepository;
    }

    /**
     * Creates the stream and the group if they do not exist yet. A new group starts at the current
     * end of the stream, so it only sees entries appended after it was created.
     */
    @Transactional
    public void ensureStreamGroup(String streamName, String groupName) {
        if (jobStreamRepository.createIfAbsent(streamName) > 0) {
            logger.info("Created stream '{}'", streamName);
        }
        JobStream stream = jobStreamRepository.findByName(streamName)
                .orElseThrow(() -> new InfrastructureException("Stream '" + streamName + "' could not be created"));
        if (consumerGroupRepository.createIfAbsent(streamName, groupName, stream.getLastPosition()) > 0) {
            logger.info("Created consumer group '{}' on stream '{}' at position {}",
                    groupName, streamName, stream.getLastPosition());
        } else {
            logger.debug("Consumer group '{}' already exists on stream '{}'", groupName, streamName);
        }
    }

    /**
     * Appends an entry and returns its log position. Joins the caller's transaction when there is one,
     * so the job record and its entry commit or roll back together.
     */
    @Transactional
    public long append(String streamName, UUID jobUuid, String parser, String sourceLocation) {
        JobStream stream = jobStreamRepository.findByNameForUpdate(streamName)
                .orElseThrow(() -> new InfrastructureException("Stream '" + streamName + "' does not exist"));
        long position = stream.advance();
        streamEntryRepository.save(new StreamEntry(streamName, position, jobUuid, parser, sourceLocation, Instant.now()));
        logger.debug("Appended job {} to stream '{}' at position {}", jobUuid, streamName, position);
        return position;
    }

    /**
     * Claims one entry for {@code consumerId}. Released claims are taken first (oldest position first),
     * then the next never-delivered entry behind the group cursor.
     */
    @Transactional
    public Optional<ClaimedEntry> claimNext(String streamName, String groupName, String consumerId) {
        Long groupId = requireGroupId(streamName, groupName);
        Instant now = Instant.now();

        Optional<PendingEntry> released = pendingEntryRepository.findFirstReleasedForUpdate(groupId);
        if (released.isPresent()) {
            PendingEntry ownership = released.get();
            Optional<StreamEntry> entry = streamEntryRepository.findByStreamNameAndPosition(
                    streamName, ownership.getEntryPosition());
            if (entry.isEmpty()) {
                logger.warn("Dropping ownership record for missing entry {} on stream '{}'",
                        ownership.getEntryPosition(), streamName);
                pendingEntryRepository.delete(ownership);
                return Optional.empty();
            }
            ownership.reassign(consumerId, now);
            logger.info("Consumer {} reclaimed entry {} (job {}, delivery attempt {})",
                    consumerId, ownership.getEntryPosition(), ownership.getJobUuid(), ownership.getDeliveryAttempts());
            return Optional.of(ClaimedEntry.of(entry.get(), ownership));
        }

        ConsumerGroup locked = consumerGroupRepository.findByIdForUpdate(groupId)
                .orElseThrow(() -> new InfrastructureException("Consumer group '" + groupName + "' disappeared"));
        Optional<StreamEntry> next = streamEntryRepository
                .findFirstByStreamNameAndPositionGreaterThanOrderByPositionAsc(streamName, locked.getLastDeliveredPosition());
        if (next.isEmpty()) {
            return Optional.empty();
        }

        StreamEntry entry = next.get();
        locked.setLastDeliveredPosition(entry.getPosition());
        PendingEntry ownership = pendingEntryRepository.save(
                new PendingEntry(locked.getId(), entry.getPosition(), entry.getJobUuid(), consumerId, now));
        logger.debug("Consumer {} claimed entry {} (job {})", consumerId, entry.getPosition(), entry.getJobUuid());
        return Optional.of(ClaimedEntry.of(entry, ownership));
    }

    /**
     * Removes the ownership record of a claim. Returns false when the claim was superseded by a reclaim.
     */
    @Transactional
    public boolean acknowledge(String streamName, String groupName, ClaimedEntry claimed) {
        Long groupId = requireGroupId(streamName, groupName);
        int deleted = pendingEntryRepository.deleteOwned(groupId, claimed.getPosition(),
                claimed.getConsumerId(), claimed.getDeliveryAttempt());
        return deleted > 0;
    }

    @Transactional(readOnly = true)
    public QueueMetrics snapshot(String streamName, String groupName) {
        ConsumerGroup group = requireGroup(streamName, groupName);
        long lastPosition = jobStreamRepository.findByName(streamName).map(JobStream::getLastPosition).orElse(0L);
        long length = streamEntryRepository.countByStreamName(streamName);
        long pending = pendingEntryRepository.countByGroupId(group.getId());

        Map<String, Long> byConsumer = new LinkedHashMap<>();
        List<Object[]> rows = pendingEntryRepository.countByConsumer(group.getId());
        for (Object[] row : rows) {
            String consumer = row[0] != null ? (String) row[0] : "(released)";
            byConsumer.put(consumer, ((Number) row[1]).longValue());
        }

        Instant oldest = pendingEntryRepository.findOldestClaimedAt(group.getId());
        Long oldestAge = oldest != null ? Duration.between(oldest, Instant.now()).getSeconds() : null;

        return new QueueMetrics(streamName, groupName, length, lastPosition, group.getLastDeliveredPosition(),
                pending, byConsumer, oldestAge);
    }

    private Long requireGroupId(String streamName, String groupName) {
        return consumerGroupRepository.findIdByName(streamName, groupName)
                .orElseThrow(() -> new InfrastructureException(
                        "Consumer group '" + groupName + "' does not exist on stream '" + streamName + "'"));
    }

    private ConsumerGroup requireGroup(String streamName, String groupName) {
        return consumerGroupRepository.findByStreamNameAndGroupName(streamName, groupName)
                .orElseThrow(() -> new InfrastructureException(
                        "Consumer group '" + groupName + "' does not exist on stream '" + streamName + "'"));
    }
}
