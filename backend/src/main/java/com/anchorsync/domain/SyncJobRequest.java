package com.anchorsync.domain;

import java.util.List;

/**
 * Payload of a sync job: which blocks to scan for anchors and which models the work is for.
 */
public record SyncJobRequest(SyncJobKind jobType, long fromBlock, long toBlock, List<String> models) {

    public SyncJobRequest {
        if (jobType == null) {
            throw new IllegalArgumentException("jobType is required");
        }
        if (fromBlock < 0 || fromBlock > toBlock) {
            throw new IllegalArgumentException("Invalid block range " + fromBlock + "-" + toBlock);
        }
        if (jobType == SyncJobKind.CONTINUOUS && fromBlock != toBlock) {
            throw new IllegalArgumentException("Continuous sync covers exactly one block, got " + fromBlock + "-" + toBlock);
        }
        models = models == null ? List.of() : List.copyOf(models);
    }

    public static SyncJobRequest catchup(long fromBlock, long toBlock, List<String> models) {
        return new SyncJobRequest(SyncJobKind.CATCHUP, fromBlock, toBlock, models);
    }

    public static SyncJobRequest full(long fromBlock, long toBlock, List<String> models) {
        return new SyncJobRequest(SyncJobKind.FULL, fromBlock, toBlock, models);
    }

    public static SyncJobRequest continuous(long block, List<String> models) {
        return new SyncJobRequest(SyncJobKind.CONTINUOUS, block, block, models);
    }
}
