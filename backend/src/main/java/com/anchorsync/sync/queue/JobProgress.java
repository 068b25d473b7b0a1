package com.anchorsync.sync.queue;

/**
 * Progress callback handed to a {@link JobWorker}: records the last block the job has fully processed.
 */
@FunctionalInterface
public interface JobProgress {

    void advanceTo(long block);
}
