package com.anchorsync.sync.worker;

import com.anchorsync.chain.anchor.AnchorProofFetcher;
import com.anchorsync.domain.AnchorProof;
import com.anchorsync.sync.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Worker for the rebuildAnchor queue: re-applies every anchor in the range.
 */
@Component
public class RebuildAnchorWorker extends AbstractAnchorWorker {

    private final AnchorProofHandler proofHandler;

    public RebuildAnchorWorker(AnchorProofFetcher proofFetcher, SyncProperties syncProperties, AnchorProofHandler proofHandler) {
        super(proofFetcher, syncProperties);
        this.proofHandler = proofHandler;
    }

    @Override
    protected void apply(AnchorProof proof, List<String> models) {
        proofHandler.rebuild(proof, models);
    }
}
