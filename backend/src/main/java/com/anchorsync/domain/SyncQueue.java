package com.anchorsync.domain;

/**
 * Named queues of the job queue. Routing only; what a job does is carried by {@link SyncJobKind}.
 */
public enum SyncQueue {
    HISTORICAL("historySync"),
    CONTINUOUS("continuousSync"),
    REBUILD("rebuildAnchor");

    private final String queueName;

    SyncQueue(String queueName) {
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }
}
