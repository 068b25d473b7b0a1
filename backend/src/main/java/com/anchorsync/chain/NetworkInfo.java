package com.anchorsync.chain;

/**
 * Network the chain provider is connected to.
 */
public record NetworkInfo(long chainId) {

    /** CAIP-2 chain id, e.g. {@code eip155:1}. */
    public String caip2() {
        return "eip155:" + chainId;
    }
}
