package com.anchorsync.domain;

/**
 * Raw anchor commitment log found on chain. {@code rootData} is the undecoded log data.
 */
public record AnchorProof(long blockNumber, String blockHash, String transactionHash, String rootData) {
}
