package com.docstream.jobs;

/**
 * Outcome of the fencing check a worker runs before touching a claimed job.
 */
public enum ClaimDecision {
    /** The job now belongs to this claim; run the pipeline. */
    PROCEED,
    /** The job already reached done or error; acknowledge and skip. */
    ALREADY_FINALIZED,
    /** A newer claim owns the job; neither process nor acknowledge. */
    SUPERSEDED,
    /** No live record for the job (expired or never written); acknowledge and skip. */
    MISSING
}
