package com.docstream.processing;

/**
 * A parsing strategy or the summarizer failed for one job. Always converted to a terminal error status.
 */
public class StrategyException extends Exception {

    public StrategyException(String message) {
        super(message);
    }

    public StrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
