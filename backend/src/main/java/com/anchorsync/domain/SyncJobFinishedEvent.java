package com.anchorsync.domain;

/**
 * Published by the job queue when a job reaches a terminal state.
 *
 * @param job    the job as last persisted
 * @param failed true when attempts were exhausted
 */
public record SyncJobFinishedEvent(QueuedJob job, boolean failed) {
}
