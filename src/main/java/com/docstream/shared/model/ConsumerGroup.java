package com.docstream.shared.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Named consumer group on a stream. The cursor is the position of the last entry handed out to any member.
 */
@Entity
@Table(name = "consumer_groups")
public class ConsumerGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stream_name", nullable = false, updatable = false, length = 128)
    private String streamName;

    @Column(name = "group_name", nullable = false, updatable = false, length = 128)
    private String groupName;

    @Column(name = "last_delivered_position", nullable = false)
    private long lastDeliveredPosition;

    @Column(name = "created_at", nullable = false, updatable = false, insertable = false)
    private Instant createdAt;

    protected ConsumerGroup() {
    }

    public Long getId() {
        return id;
    }

    public String getStreamName() {
        return streamName;
    }

    public String getGroupName() {
        return groupName;
    }

    public long getLastDeliveredPosition() {
        return lastDeliveredPosition;
    }

    public void setLastDeliveredPosition(long lastDeliveredPosition) {
        this.lastDeliveredPosition = lastDeliveredPosition;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
