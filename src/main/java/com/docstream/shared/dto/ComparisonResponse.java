package com.docstream.shared.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Map;

/**
 * DTO for a parser comparison: one terminal snapshot per requested parser, in request order.
 */
public class ComparisonResponse {

    private String filename;
    private Map<String, ParserResult> results;

    public ComparisonResponse() {
    }

    public ComparisonResponse(String filename, Map<String, ParserResult> results) {
        this.filename = filename;
        this.results = results;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Map<String, ParserResult> getResults() {
        return results;
    }

    public void setResults(Map<String, ParserResult> results) {
        this.results = results;
    }

    /**
     * Job snapshot for one parser. {@code timedOut} is set when polling gave up before the job finished;
     * {@code submissionError} when the job could not be queued at all.
     */
    public static class ParserResult {
        @JsonUnwrapped
        private JobStatusResponse snapshot;
        private boolean timedOut;
        private String submissionError;

        public ParserResult() {
        }

        public ParserResult(JobStatusResponse snapshot, boolean timedOut) {
            this.snapshot = snapshot;
            this.timedOut = timedOut;
        }

        public static ParserResult submissionFailed(String error) {
            ParserResult result = new ParserResult();
            result.setSubmissionError(error);
            return result;
        }

        public JobStatusResponse getSnapshot() {
            return snapshot;
        }

        public void setSnapshot(JobStatusResponse snapshot) {
            this.snapshot = snapshot;
        }

        public boolean isTimedOut() {
            return timedOut;
        }

        public void setTimedOut(boolean timedOut) {
            this.timedOut = timedOut;
        }

        public String getSubmissionError() {
            return submissionError;
        }

        public void setSubmissionError(String submissionError) {
            this.submissionError = submissionError;
        }
    }
}
