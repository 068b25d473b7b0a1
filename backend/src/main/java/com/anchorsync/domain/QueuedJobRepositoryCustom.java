package com.anchorsync.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Atomic job-queue operations on sync_jobs.
 */
public interface QueuedJobRepositoryCustom {

    /**
     * Moves the oldest CREATED job of the queue whose startAfter has passed to ACTIVE and returns it.
     */
    Optional<QueuedJob> claimNext(SyncQueue queue, Instant now);

    /** Sets data.currentBlock and refreshes the heartbeat of an ACTIVE job. */
    void updateCurrentBlock(String jobId, long currentBlock, Instant now);

    /**
     * Like {@link #updateCurrentBlock} but only while the job is still held by the claim that started at claimedAt.
     *
     * @return false when the job was reclaimed or finished elsewhere
     */
    boolean updateClaimedCurrentBlock(String jobId, Instant claimedAt, long currentBlock, Instant now);

    /** Refreshes the heartbeat of a job still held by the claim that started at claimedAt. */
    boolean touchHeartbeat(String jobId, Instant claimedAt, Instant now);

    /**
     * Writes the outcome fields of the job (state, attempts, lastError, startAfter, startedOn, heartbeatAt,
     * completedOn) if it is still ACTIVE under the claim that started at claimedAt.
     *
     * @return true when this claim owned the job and the outcome was stored
     */
    boolean releaseClaim(QueuedJob job, Instant claimedAt);

    /**
     * Returns ACTIVE jobs whose heartbeat is older than the cutoff to CREATED (their worker is gone).
     *
     * @return number of jobs requeued
     */
    long requeueStaleActive(Instant heartbeatBefore, Instant now);
}
