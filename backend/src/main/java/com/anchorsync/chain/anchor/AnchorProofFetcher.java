package com.anchorsync.chain.anchor;

import com.anchorsync.domain.AnchorProof;

import java.util.List;

/**
 * Finds anchor commitments recorded on chain in a block range (inclusive).
 */
public interface AnchorProofFetcher {

    List<AnchorProof> fetch(long fromBlock, long toBlock);
}
