package com.docstream.shared.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Ownership record for a delivered but unacknowledged entry.
 * A null consumer id means the claim was released by the reaper and waits for reclaim.
 */
@Entity
@Table(name = "pending_entries")
public class PendingEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private Long groupId;

    @Column(name = "entry_position", nullable = false, updatable = false)
    private long entryPosition;

    @Column(name = "job_uuid", nullable = false, updatable = false)
    private UUID jobUuid;

    @Column(name = "consumer_id", length = 128)
    private String consumerId;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;

    @Column(name = "delivery_attempts", nullable = false)
    private int deliveryAttempts;

    protected PendingEntry() {
    }

    public PendingEntry(Long groupId, long entryPosition, UUID jobUuid, String consumerId, Instant claimedAt) {
        this.groupId = groupId;
        this.entryPosition = entryPosition;
        this.jobUuid = jobUuid;
        this.consumerId = consumerId;
        this.claimedAt = claimedAt;
        this.deliveryAttempts = 1;
    }

    /**
     * Hands a released entry to a new consumer. The previous claim is superseded, not duplicated.
     */
    public void reassign(String newConsumerId, Instant now) {
        this.consumerId = newConsumerId;
        this.claimedAt = now;
        this.deliveryAttempts++;
    }

    public void release() {
        this.consumerId = null;
    }

    public boolean isReleased() {
        return consumerId == null;
    }

    public Long getId() {
        return id;
    }

    public Long getGroupId() {
        return groupId;
    }

    public long getEntryPosition() {
        return entryPosition;
    }

    public UUID getJobUuid() {
        return jobUuid;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public int getDeliveryAttempts() {
        return deliveryAttempts;
    }
}
