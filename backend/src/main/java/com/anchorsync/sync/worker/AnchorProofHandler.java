package com.anchorsync.sync.worker;

import com.anchorsync.domain.AnchorProof;

import java.util.List;

/**
 * Applies an anchor commitment found on chain to the streams of the given models. Implementations must tolerate
 * seeing the same proof more than once.
 */
public interface AnchorProofHandler {

    void handle(AnchorProof proof, List<String> models);

    /** Re-applies a proof during an explicit rebuild. Defaults to {@link #handle}. */
    default void rebuild(AnchorProof proof, List<String> models) {
        handle(proof, models);
    }
}
