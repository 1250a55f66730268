package com.docstream.shared.dto;

import java.util.List;
import java.util.UUID;

/**
 * DTO for a batch upload: one outcome per file, in request order.
 */
public class BatchUploadResponse {

    private int totalFiles;
    private int successful;
    private int failed;
    private List<FileResult> results;

    public BatchUploadResponse() {
    }

    public BatchUploadResponse(List<FileResult> results) {
        this.results = results;
        this.totalFiles = results.size();
        this.successful = (int) results.stream().filter(FileResult::isAccepted).count();
        this.failed = totalFiles - successful;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public void setTotalFiles(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    public int getSuccessful() {
        return successful;
    }

    public void setSuccessful(int successful) {
        this.successful = successful;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public List<FileResult> getResults() {
        return results;
    }

    public void setResults(List<FileResult> results) {
        this.results = results;
    }

    /**
     * Outcome for one file: a job id, or an inline error.
     */
    public static class FileResult {
        private String filename;
        private UUID jobId;
        private String error;

        public FileResult() {
        }

        public static FileResult accepted(String filename, UUID jobId) {
            FileResult result = new FileResult();
            result.setFilename(filename);
            result.setJobId(jobId);
            return result;
        }

        public static FileResult rejected(String filename, String error) {
            FileResult result = new FileResult();
            result.setFilename(filename);
            result.setError(error);
            return result;
        }

        public boolean isAccepted() {
            return jobId != null;
        }

        public String getFilename() {
            return filename;
        }

        public void setFilename(String filename) {
            this.filename = filename;
        }

        public UUID getJobId() {
            return jobId;
        }

        public void setJobId(UUID jobId) {
            this.jobId = jobId;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }
    }
}
