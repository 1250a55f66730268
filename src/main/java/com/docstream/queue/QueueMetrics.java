package com.docstream.queue;

import java.util.Map;

/**
 * Point-in-time view of the stream and its consumer group.
 */
public class QueueMetrics {

    private final String streamName;
    private final String groupName;
    private final long streamLength;
    private final long lastPosition;
    private final long groupCursor;
    private final long pendingCount;
    private final Map<String, Long> pendingByConsumer;
    private final Long oldestPendingAgeSeconds;

    public QueueMetrics(String streamName, String groupName, long streamLength, long lastPosition,
                        long groupCursor, long pendingCount, Map<String, Long> pendingByConsumer,
                        Long oldestPendingAgeSeconds) {
        this.streamName = streamName;
        this.groupName = groupName;
        this.streamLength = streamLength;
        this.lastPosition = lastPosition;
        this.groupCursor = groupCursor;
        this.pendingCount = pendingCount;
        this.pendingByConsumer = pendingByConsumer;
        this.oldestPendingAgeSeconds = oldestPendingAgeSeconds;
    }

    public String getStreamName() {
        return streamName;
    }

    public String getGroupName() {
        return groupName;
    }

    public long getStreamLength() {
        return streamLength;
    }

    public long getLastPosition() {
        return lastPosition;
    }

    public long getGroupCursor() {
        return groupCursor;
    }

    /**
     * Entries appended but not yet handed to any consumer.
     */
    public long getUndeliveredCount() {
        return Math.max(0, lastPosition - groupCursor);
    }

    public long getPendingCount() {
        return pendingCount;
    }

    public Map<String, Long> getPendingByConsumer() {
        return pendingByConsumer;
    }

    public Long getOldestPendingAgeSeconds() {
        return oldestPendingAgeSeconds;
    }
}
