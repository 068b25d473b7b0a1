package com.anchorsync.admin;

/**
 * An indexed model and whether its historical sync has finished.
 */
public record ModelSyncState(String model, boolean syncComplete, int outstandingHistoricalSyncs) {
}
