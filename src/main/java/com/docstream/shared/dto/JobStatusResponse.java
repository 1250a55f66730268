package com.docstream.shared.dto;

import com.docstream.shared.model.DocumentJob;
import com.docstream.shared.model.JobStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a job's state. Also used as the per-parser snapshot in comparisons.
 */
public class JobStatusResponse {

    private UUID jobId;
    private JobStatus status;
    private String parser;
    private String filename;
    private Integer pageCount;
    private String errorMessage;
    private Instant createdAt;
    private Instant updatedAt;

    public JobStatusResponse() {
    }

    public static JobStatusResponse from(DocumentJob job) {
        JobStatusResponse response = new JobStatusResponse();
        response.setJobId(job.getJobUuid());
        response.setStatus(job.getStatus());
        response.setParser(job.getParser());
        response.setFilename(job.getFilename());
        response.setPageCount(job.getPageCount());
        response.setErrorMessage(job.getErrorMessage());
        response.setCreatedAt(job.getCreatedAt());
        response.setUpdatedAt(job.getUpdatedAt());
        return response;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getParser() {
        return parser;
    }

    public void setParser(String parser) {
        this.parser = parser;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public void setPageCount(Integer pageCount) {
        this.pageCount = pageCount;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
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
}
