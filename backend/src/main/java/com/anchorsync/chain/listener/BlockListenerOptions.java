package com.anchorsync.chain.listener;

import com.anchorsync.chain.ChainProvider;

/**
 * @param confirmations      depth a block must reach before it is emitted
 * @param chainId            CAIP-2 chain id, for logging
 * @param provider           chain access
 * @param expectedParentHash hash of the last block already handled; emission starts at its child.
 *                           Null starts at the current confirmed tip.
 */
public record BlockListenerOptions(int confirmations, String chainId, ChainProvider provider, String expectedParentHash) {
}
