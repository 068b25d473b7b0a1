package com.anchorsync.sync.queue;

import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.SyncJobRequest;
import com.anchorsync.domain.SyncQueue;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable queue of sync jobs with at-least-once execution. The queue owns retries; completion and terminal failure
 * are announced with a {@link com.anchorsync.domain.SyncJobFinishedEvent}.
 */
public interface JobQueue {

    /**
     * Registers the workers and starts dispatch. May be called once.
     *
     * @throws IllegalStateException when already initialized
     */
    void init(JobWorkers workers);

    /** Persists a new job; returns without waiting for it to run. */
    QueuedJob addJob(SyncQueue queue, SyncJobRequest request);

    /**
     * Point-in-time snapshot of the jobs in the given state, keyed by queue. Every requested queue is present.
     */
    Map<SyncQueue, List<QueuedJob>> getJobs(JobState state, Collection<SyncQueue> queues);

    void updateCurrentBlock(String jobId, long block);

    /** Stops dispatch and waits (bounded) for in-flight jobs. */
    void stop();
}
