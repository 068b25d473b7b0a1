package com.anchorsync.sync.worker;

import com.anchorsync.chain.anchor.AnchorProofFetcher;
import com.anchorsync.domain.AnchorProof;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.SyncQueue;
import com.anchorsync.sync.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Worker for the historySync and continuousSync queues. Continuous jobs cover a single block, so only historical
 * jobs record a progress cursor.
 */
@Component
public class SyncWorker extends AbstractAnchorWorker {

    private final AnchorProofHandler proofHandler;

    public SyncWorker(AnchorProofFetcher proofFetcher, SyncProperties syncProperties, AnchorProofHandler proofHandler) {
        super(proofFetcher, syncProperties);
        this.proofHandler = proofHandler;
    }

    @Override
    protected void apply(AnchorProof proof, List<String> models) {
        proofHandler.handle(proof, models);
    }

    @Override
    protected boolean tracksProgress(QueuedJob job) {
        return job.getQueue() != SyncQueue.CONTINUOUS;
    }
}
