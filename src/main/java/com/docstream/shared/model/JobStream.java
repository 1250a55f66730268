package com.docstream.shared.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Head of one append-only stream. {@code lastPosition} is the log position of the newest entry.
 */
@Entity
@Table(name = "job_streams")
public class JobStream {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 128)
    private String name;

    @Column(name = "last_position", nullable = false)
    private long lastPosition;

    @Column(name = "created_at", nullable = false, updatable = false, insertable = false)
    private Instant createdAt;

    protected JobStream() {
    }

    public JobStream(String name) {
        this.name = name;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getLastPosition() {
        return lastPosition;
    }

    /**
     * Reserves the next log position. Callers hold the row lock.
     */
    public long advance() {
        lastPosition++;
        return lastPosition;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
