package com.anchorsync.chain.listener;

import com.anchorsync.domain.BlockConfirmationEvent;
import reactor.core.publisher.Flux;

/**
 * Creates the stream of confirmed blocks the sync engine subscribes to. Events are emitted in block order,
 * one at a time, and the stream never completes on its own.
 */
public interface BlockConfirmationListenerFactory {

    Flux<BlockConfirmationEvent> create(BlockListenerOptions options);
}
