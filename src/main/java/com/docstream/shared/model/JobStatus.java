package com.docstream.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a document job. Transitions are monotonic:
 * PENDING to PROCESSING to one of DONE or ERROR. Terminal states never change.
 */
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    DONE("done"),
    ERROR("error");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /**
     * PROCESSING to PROCESSING is allowed so a reclaimed entry can take over a superseded claim.
     */
    public boolean canTransitionTo(JobStatus next) {
        switch (this) {
            case PENDING:
                return next == PROCESSING || next == ERROR;
            case PROCESSING:
                return next == PROCESSING || next.isTerminal();
            default:
                return false;
        }
    }
}
