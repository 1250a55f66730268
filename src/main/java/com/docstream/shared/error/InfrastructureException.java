package com.docstream.shared.error;

/**
 * The job store, the queue or source storage could not be reached.
 * Surfaced synchronously at ingestion; inside the worker it leaves the entry unacknowledged for redelivery.
 */
public class InfrastructureException extends RuntimeException {

    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
