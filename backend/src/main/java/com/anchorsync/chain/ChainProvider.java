package com.anchorsync.chain;

import com.anchorsync.domain.BlockHeader;

/**
 * Read access to the anchoring chain. All calls are blocking and throw {@link RpcException} on failure.
 */
public interface ChainProvider {

    /**
     * Block relative to the current head: 0 is the head, negative values are that many blocks behind it
     * (clamped at genesis).
     */
    BlockHeader getBlock(long offsetFromHead);

    BlockHeader getBlockByNumber(long number);

    BlockHeader getBlockByHash(String hash);

    long getBlockNumber();

    NetworkInfo getNetwork();
}
