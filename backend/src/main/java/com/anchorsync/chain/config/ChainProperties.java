package com.anchorsync.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * EVM chain access: endpoints, RPC budget, retry schedule, block polling and the anchor contract to scan.
 */
@ConfigurationProperties(prefix = "anchorsync.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>();

    /** Interval between head-height polls of the block confirmation listener. */
    private long blockPollIntervalMs = 4000L;

    /** Upper bound of blocks emitted by a single poll, so a long outage is drained over several ticks. */
    private int maxBlocksPerPoll = 100;

    /** Global RPC budget shared by every caller. */
    private int maxRequestsPerSecond = 50;

    /** Max wait for a limiter permit before the call fails. */
    private long limiterTimeoutMs = 2000L;

    /** Address of the anchor contract whose logs carry anchor commitments. */
    private String anchorContractAddress;

    /** Topic0 of the anchor event; null means any event of the contract. */
    private String anchorEventTopic;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 1000L;
        private long maxDelayMs = 30_000L;
        private double jitterFactor = 0.2;
        private int maxAttempts = 5;
    }
}
