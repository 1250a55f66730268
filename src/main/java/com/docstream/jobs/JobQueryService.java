package com.docstream.jobs;

import com.docstream.shared.dto.JobResultResponse;
import com.docstream.shared.dto.JobStatusResponse;
import com.docstream.shared.error.JobFailedException;
import com.docstream.shared.error.JobNotFoundException;
import com.docstream.shared.error.JobNotReadyException;
import com.docstream.shared.model.DocumentJob;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Read side of the job state store. Never touches the queue or any external provider.
 */
@Service
public class JobQueryService {

    private static final Pattern COMPACT_UUID = Pattern.compile("^[0-9a-fA-F]{32}$");

    private final JobStateStore jobStateStore;

    public JobQueryService(JobStateStore jobStateStore) {
        this.jobStateStore = jobStateStore;
    }

    public JobStatusResponse status(String jobId) {
        return JobStatusResponse.from(load(jobId));
    }

    /**
     * Snapshot by UUID, empty when the job is unknown or expired.
     */
    public Optional<JobStatusResponse> findStatus(UUID jobUuid) {
        return jobStateStore.find(jobUuid).map(JobStatusResponse::from);
    }

    /**
     * Full record of a finished job.
     *
     * @throws JobNotReadyException while the job is pending or processing
     * @throws JobFailedException when the job ended in error; carries the stored message
     */
    public JobResultResponse result(String jobId) {
        DocumentJob job = load(jobId);
        switch (job.getStatus()) {
            case DONE:
                return JobResultResponse.from(job);
            case ERROR:
                throw new JobFailedException(job.getJobUuid(), job.getErrorMessage());
            default:
                throw new JobNotReadyException(job.getJobUuid(), job.getStatus());
        }
    }

    private DocumentJob load(String jobId) {
        UUID jobUuid = parseJobId(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        return jobStateStore.find(jobUuid)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Accepts the canonical dashed form and the 32-character hex form.
     */
    static Optional<UUID> parseJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        String value = jobId.trim();
        if (COMPACT_UUID.matcher(value).matches()) {
            value = value.substring(0, 8) + "-" + value.substring(8, 12) + "-" + value.substring(12, 16)
                    + "-" + value.substring(16, 20) + "-" + value.substring(20);
        }
        try {
            UUID parsed = UUID.fromString(value);
            // UUID.fromString is lenient about short groups
            return parsed.toString().equalsIgnoreCase(value) ? Optional.of(parsed) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
