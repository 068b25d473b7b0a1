package com.anchorsync.sync.status;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of sync work, built fresh on each request.
 */
public record SyncStatusSnapshot(List<ActiveSync> activeSyncs,
                                 List<PendingSync> pendingSyncs,
                                 List<ContinuousSync> continuousSync) {

    public record ActiveSync(List<String> models, long startBlock, Long currentBlock, long endBlock,
                             Instant startedAt, Instant createdAt) {
    }

    public record PendingSync(List<String> models, long startBlock, long endBlock, Instant createdAt) {
    }

    public record ContinuousSync(long startBlock, long currentBlock, long latestBlock, int confirmations,
                                 List<String> models) {
    }
}
