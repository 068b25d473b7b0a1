package com.anchorsync.sync.queue;

import com.anchorsync.domain.QueuedJob;

/**
 * Executes one claimed job. Must be idempotent over the job's block range: a job may run again after a crash
 * or a retry. Throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface JobWorker {

    void process(QueuedJob job, JobProgress progress) throws Exception;
}
