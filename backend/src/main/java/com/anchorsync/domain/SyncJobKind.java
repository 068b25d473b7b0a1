package com.anchorsync.domain;

/**
 * Semantic type of a sync job. CATCHUP and FULL cover bounded historical ranges; CONTINUOUS covers one live block.
 */
public enum SyncJobKind {
    CATCHUP,
    FULL,
    CONTINUOUS
}
