package com.anchorsync.chain.listener;

import com.anchorsync.domain.BlockConfirmationEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Default listener: polls the chain head on a fixed interval. A failed poll is logged and retried on the next
 * tick without losing the cursor.
 */
@Slf4j
public class PollingBlockConfirmationListenerFactory implements BlockConfirmationListenerFactory {

    private final Duration pollInterval;
    private final int maxBlocksPerPoll;

    public PollingBlockConfirmationListenerFactory(Duration pollInterval, int maxBlocksPerPoll) {
        this.pollInterval = pollInterval;
        this.maxBlocksPerPoll = maxBlocksPerPoll;
    }

    @Override
    public Flux<BlockConfirmationEvent> create(BlockListenerOptions options) {
        return Flux.defer(() -> {
            BlockConfirmationPoller poller = new BlockConfirmationPoller(
                    options.provider(), options.confirmations(), maxBlocksPerPoll, options.expectedParentHash());
            log.info("Listening for blocks on {} with {} confirmations", options.chainId(), options.confirmations());
            return Flux.interval(Duration.ZERO, pollInterval)
                    .onBackpressureDrop()
                    .concatMap(tick -> Mono.fromCallable(poller::poll)
                            .subscribeOn(Schedulers.boundedElastic())
                            .onErrorResume(e -> {
                                log.warn("Block poll on {} failed, retrying next tick: {}", options.chainId(), e.getMessage());
                                return Mono.empty();
                            }), 1)
                    .concatMapIterable(events -> events);
        });
    }
}
