package com.anchorsync.domain;

/**
 * Queue-owned lifecycle of a {@link QueuedJob}. COMPLETED and FAILED are terminal; a transient failure puts
 * the job back to CREATED with a later startAfter.
 */
public enum JobState {
    CREATED,
    ACTIVE,
    COMPLETED,
    FAILED
}
