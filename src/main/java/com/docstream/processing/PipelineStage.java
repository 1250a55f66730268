package com.docstream.processing;

/**
 * Stages of one worker iteration over a claimed entry.
 */
public enum PipelineStage {
    CLAIMED,
    PARSING,
    SUMMARIZING,
    FINALIZED;

    public String label() {
        return name().toLowerCase();
    }
}
