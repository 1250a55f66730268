package com.docstream.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entity representing one document parsing job.
 * Maps to the document_jobs table.
 *
 * <p>While a job is PROCESSING, {@code ownerConsumer} and {@code fenceToken} identify the claim
 * that is allowed to finalize it. The fence token is the delivery attempt number of that claim,
 * so a reclaimed entry always carries a larger token than the claim it replaced.
 */
@Entity
@Table(name = "document_jobs")
public class DocumentJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_uuid", nullable = false, unique = true, updatable = false)
    @NotNull
    private UUID jobUuid;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "parser", nullable = false, length = 50)
    @Size(max = 50)
    private String parser;

    @Column(name = "filename", length = 255)
    @Size(max = 255)
    private String filename;

    @Column(name = "source_location", length = 512)
    @Size(max = 512)
    private String sourceLocation;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @Column(name = "page_count")
    private Integer pageCount;

    @Column(name = "summary_md", columnDefinition = "TEXT")
    private String summaryMd;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "per_page_markdown", columnDefinition = "jsonb")
    private List<PageMarkdown> perPageMarkdown;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "owner_consumer", length = 128)
    private String ownerConsumer;

    @Column(name = "fence_token")
    private Integer fenceToken;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "ttl_expires_at")
    private Instant ttlExpiresAt;

    protected DocumentJob() {
    }

    public DocumentJob(UUID jobUuid, String parser) {
        this.jobUuid = jobUuid;
        this.parser = parser;
        this.status = JobStatus.PENDING;
    }

    public boolean isExpired(Instant now) {
        return ttlExpiresAt != null && !ttlExpiresAt.isAfter(now);
    }

    /**
     * True when the given claim is the one currently allowed to write the terminal state.
     */
    public boolean isHeldBy(String consumerId, int attempt) {
        return status == JobStatus.PROCESSING
                && Objects.equals(ownerConsumer, consumerId)
                && fenceToken != null
                && fenceToken == attempt;
    }

    /**
     * True when a PROCESSING record belongs to an older claim than {@code attempt}.
     */
    public boolean isSupersededBy(int attempt) {
        return status == JobStatus.PROCESSING && (fenceToken == null || fenceToken < attempt);
    }

    public void markProcessing(String consumerId, int attempt, Instant now) {
        transitionTo(JobStatus.PROCESSING);
        this.ownerConsumer = consumerId;
        this.fenceToken = attempt;
        if (this.startedAt == null) {
            this.startedAt = now;
        }
    }

    public void complete(List<PageMarkdown> pages, String summary, Instant now, Duration ttl) {
        transitionTo(JobStatus.DONE);
        this.perPageMarkdown = new ArrayList<>(pages);
        this.pageCount = pages.size();
        this.summaryMd = summary;
        this.errorMessage = null;
        finish(now, ttl);
    }

    public void fail(String message, Instant now, Duration ttl) {
        transitionTo(JobStatus.ERROR);
        this.errorMessage = message;
        this.pageCount = null;
        this.summaryMd = null;
        this.perPageMarkdown = null;
        finish(now, ttl);
    }

    private void finish(Instant now, Duration ttl) {
        this.completedAt = now;
        this.ttlExpiresAt = ttl.isZero() || ttl.isNegative() ? null : now.plus(ttl);
    }

    private void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Illegal status transition for job %s: %s -> %s", jobUuid, status, next));
        }
        this.status = next;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public UUID getJobUuid() {
        return jobUuid;
    }

    public JobStatus getStatus() {
        return status;
    }

    public String getParser() {
        return parser;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getSourceLocation() {
        return sourceLocation;
    }

    public void setSourceLocation(String sourceLocation) {
        this.sourceLocation = sourceLocation;
    }

    public Long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public void setFileSizeBytes(Long fileSizeBytes) {
        this.fileSizeBytes = fileSizeBytes;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public String getSummaryMd() {
        return summaryMd;
    }

    public List<PageMarkdown> getPerPageMarkdown() {
        return perPageMarkdown;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getOwnerConsumer() {
        return ownerConsumer;
    }

    public Integer getFenceToken() {
        return fenceToken;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getTtlExpiresAt() {
        return ttlExpiresAt;
    }
}
