package com.docstream.shared.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One queue entry. Immutable once appended.
 */
@Entity
@Table(name = "stream_entries")
public class StreamEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stream_name", nullable = false, updatable = false, length = 128)
    private String streamName;

    @Column(name = "position", nullable = false, updatable = false)
    private long position;

    @Column(name = "job_uuid", nullable = false, updatable = false)
    private UUID jobUuid;

    @Column(name = "parser", nullable = false, updatable = false, length = 50)
    private String parser;

    @Column(name = "source_location", nullable = false, updatable = false, length = 512)
    private String sourceLocation;

    @Column(name = "appended_at", nullable = false, updatable = false)
    private Instant appendedAt;

    protected StreamEntry() {
    }

    public StreamEntry(String streamName, long position, UUID jobUuid, String parser,
                       String sourceLocation, Instant appendedAt) {
        this.streamName = streamName;
        this.position = position;
        this.jobUuid = jobUuid;
        this.parser = parser;
        this.sourceLocation = sourceLocation;
        this.appendedAt = appendedAt;
    }

    public Long getId() {
        return id;
    }

    public String getStreamName() {
        return streamName;
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

    public Instant getAppendedAt() {
        return appendedAt;
    }
}
