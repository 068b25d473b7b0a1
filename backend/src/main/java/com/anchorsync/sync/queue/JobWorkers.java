package com.anchorsync.sync.queue;

import com.anchorsync.domain.SyncQueue;

import java.util.Objects;

/**
 * One worker per queue, registered with {@link JobQueue#init(JobWorkers)}.
 */
public record JobWorkers(JobWorker rebuildAnchor, JobWorker historySync, JobWorker continuousSync) {

    public JobWorkers {
        Objects.requireNonNull(rebuildAnchor, "rebuildAnchor");
        Objects.requireNonNull(historySync, "historySync");
        Objects.requireNonNull(continuousSync, "continuousSync");
    }

    public JobWorker forQueue(SyncQueue queue) {
        return switch (queue) {
            case REBUILD -> rebuildAnchor;
            case HISTORICAL -> historySync;
            case CONTINUOUS -> continuousSync;
        };
    }
}
