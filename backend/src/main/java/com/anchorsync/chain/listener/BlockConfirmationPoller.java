package com.anchorsync.chain.listener;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.domain.BlockConfirmationEvent;
import com.anchorsync.domain.BlockHeader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateful cursor behind the polling listener. Each {@link #poll()} returns the blocks that became confirmed
 * since the previous call. A block whose parent hash differs from the hash of the previously emitted block is
 * flagged as reorganized. Not thread-safe; the listener calls it sequentially.
 */
@Slf4j
public class BlockConfirmationPoller {

    private final ChainProvider provider;
    private final int confirmations;
    private final int maxBlocksPerPoll;
    private final String startHash;

    private boolean initialized;
    private long nextBlock;
    private String lastEmittedHash;

    public BlockConfirmationPoller(ChainProvider provider, int confirmations, int maxBlocksPerPoll, String startHash) {
        if (confirmations < 0) {
            throw new IllegalArgumentException("confirmations must not be negative");
        }
        this.provider = provider;
        this.confirmations = confirmations;
        this.maxBlocksPerPoll = Math.max(1, maxBlocksPerPoll);
        this.startHash = startHash;
    }

    public List<BlockConfirmationEvent> poll() {
        if (!initialized) {
            initialize();
        }
        long confirmedTip = provider.getBlockNumber() - confirmations;
        List<BlockConfirmationEvent> events = new ArrayList<>();
        while (nextBlock <= confirmedTip && events.size() < maxBlocksPerPoll) {
            BlockHeader block;
            try {
                block = provider.getBlockByNumber(nextBlock);
            } catch (RuntimeException e) {
                if (events.isEmpty()) {
                    throw e;
                }
                log.warn("Block {} fetch failed, emitting {} blocks fetched so far: {}", nextBlock, events.size(), e.getMessage());
                break;
            }
            if (lastEmittedHash != null && !lastEmittedHash.equals(block.parentHash())) {
                log.warn("Reorganization detected at block {}: expected parent {}, got {}",
                        block.number(), lastEmittedHash, block.parentHash());
                events.add(BlockConfirmationEvent.reorganized(block, block.parentHash()));
            } else {
                events.add(BlockConfirmationEvent.confirmed(block));
            }
            lastEmittedHash = block.hash();
            nextBlock = block.number() + 1;
        }
        return events;
    }

    private void initialize() {
        if (startHash != null) {
            BlockHeader start = provider.getBlockByHash(startHash);
            nextBlock = start.number() + 1;
            lastEmittedHash = start.hash();
        } else {
            nextBlock = Math.max(0, provider.getBlockNumber() - confirmations);
            lastEmittedHash = null;
        }
        initialized = true;
        log.debug("Block confirmation poller starting at block {}", nextBlock);
    }

    long getNextBlock() {
        return nextBlock;
    }
}
