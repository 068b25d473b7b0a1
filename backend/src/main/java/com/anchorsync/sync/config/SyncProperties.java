package com.anchorsync.sync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Anchor sync engine settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "anchorsync.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** When false the engine is not started on application ready. */
    private boolean enabled = true;

    /** Depth a block must reach before it is treated as final. */
    private int blockConfirmations = 20;

    /** Interval of the periodic status log line. */
    private long statusLogIntervalMs = 60_000L;

    /** Blocks per eth_getLogs range walked by the sync workers. */
    private long blockChunkSize = 1000L;

    /** First block newly indexed models are backfilled from. */
    private long startBlock = 0L;
}
