package com.anchorsync.domain;

/**
 * Last block whose confirmation event has been scheduled. A null block number means the node has never synced,
 * which is not the same as having synced up to block 0.
 */
public record SyncProgress(String processedBlockHash, Long processedBlockNumber) {

    private static final SyncProgress UNSET = new SyncProgress(null, null);

    public static SyncProgress unset() {
        return UNSET;
    }

    public static SyncProgress of(BlockHeader block) {
        return new SyncProgress(block.hash(), block.number());
    }

    public boolean isUnset() {
        return processedBlockNumber == null;
    }
}
