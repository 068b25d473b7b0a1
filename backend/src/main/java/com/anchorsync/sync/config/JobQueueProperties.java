package com.anchorsync.sync.config;

import com.anchorsync.domain.SyncQueue;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Durable job queue: worker counts per queue, polling, retry schedule and retention.
 */
@ConfigurationProperties(prefix = "anchorsync.jobs")
@NoArgsConstructor
@Getter
@Setter
public class JobQueueProperties {

    private int historyWorkers = 1;
    private int continuousWorkers = 1;
    private int rebuildWorkers = 1;

    /** Idle wait of a worker loop when its queue has no runnable job. */
    private long pollIntervalMs = 1000L;

    /** Total attempts per job, including the first. */
    private int maxAttempts = 5;
    private long retryBaseDelayMs = 1000L;
    private long retryMaxDelayMs = 300_000L;
    private double retryJitterFactor = 0.2;

    /** ACTIVE jobs without a heartbeat for this long are given back to the queue. */
    private long staleActiveAfterMs = 600_000L;

    /** Heartbeat refresh interval of running jobs; keep well below staleActiveAfterMs. */
    private long heartbeatIntervalMs = 30_000L;

    /** Interval of the stale-job reclaim pass. */
    private long reclaimIntervalMs = 60_000L;

    /** Completed and failed jobs are deleted after this many hours. */
    private int retentionHours = 24;

    /** Max wait for in-flight jobs on stop. */
    private long shutdownTimeoutMs = 30_000L;

    public int workersFor(SyncQueue queue) {
        int n = switch (queue) {
            case HISTORICAL -> historyWorkers;
            case CONTINUOUS -> continuousWorkers;
            case REBUILD -> rebuildWorkers;
        };
        return Math.max(1, n);
    }
}
