package com.docstream.shared.error;

import com.docstream.shared.model.JobStatus;

import java.util.UUID;

/**
 * Result requested for a job that is still pending or processing.
 */
public class JobNotReadyException extends RuntimeException {

    private final UUID jobId;
    private final JobStatus status;

    public JobNotReadyException(UUID jobId, JobStatus status) {
        super("Job is still " + status.value() + ". Please check back later.");
        this.jobId = jobId;
        this.status = status;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
