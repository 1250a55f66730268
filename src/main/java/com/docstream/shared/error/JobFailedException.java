package com.docstream.shared.error;

import java.util.UUID;

/**
 * Result requested for a job that ended in error. The message is the stored error message, verbatim.
 */
public class JobFailedException extends RuntimeException {

    private final UUID jobId;

    public JobFailedException(UUID jobId, String errorMessage) {
        super(errorMessage);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
