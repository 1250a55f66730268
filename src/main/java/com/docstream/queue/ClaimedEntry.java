package com.docstream.queue;

import com.docstream.shared.model.PendingEntry;
import com.docstream.shared.model.StreamEntry;

import java.time.Instant;
import java.util.UUID;

/**
 * A queue entry delivered to one consumer, together with the ownership it was delivered under.
 */
public final class ClaimedEntry {

    private final long position;
    private final UUID jobUuid;
    private final String parser;
    private final String sourceLocation;
    private final String consumerId;
    private final int deliveryAttempt;
    private final Instant claimedAt;

    public ClaimedEntry(long position, UUID jobUuid, String parser, String sourceLocation,
                        String consumerId, int deliveryAttempt, Instant claimedAt) {
        this.position = position;
        this.jobUuid = jobUuid;
        this.parser = parser;
        this.sourceLocation = sourceLocation;
        this.consumerId = consumerId;
        this.deliveryAttempt = deliveryAttempt;
        this.claimedAt = claimedAt;
    }

    static ClaimedEntry of(StreamEntry entry, PendingEntry ownership) {
        return new ClaimedEntry(entry.getPosition(), entry.getJobUuid(), entry.getParser(),
                entry.getSourceLocation(), ownership.getConsumerId(), ownership.getDeliveryAttempts(),
                ownership.getClaimedAt());
    }

    public long getPosition() {
        return position;
    }

    public UUID getJobUuid() {
        return jobUuid;
    }

    public String getParser() {
        return parser;
    }

    public String getSourceLocation() {
        return sourceLocation;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public int getDeliveryAttempt() {
        return deliveryAttempt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public boolean isRedelivery() {
        return deliveryAttempt > 1;
    }

    @Override
    public String toString() {
        return "ClaimedEntry{position=" + position + ", jobUuid=" + jobUuid + ", parser=" + parser
                + ", consumerId=" + consumerId + ", attempt=" + deliveryAttempt + "}";
    }
}
