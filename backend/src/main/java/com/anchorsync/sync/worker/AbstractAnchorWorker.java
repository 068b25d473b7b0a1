package com.anchorsync.sync.worker;

import com.anchorsync.chain.anchor.AnchorProofFetcher;
import com.anchorsync.domain.AnchorProof;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.sync.config.SyncProperties;
import com.anchorsync.sync.queue.JobProgress;
import com.anchorsync.sync.queue.JobWorker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Walks a job's block range in chunks, fetching anchor proofs and applying each. A retried job resumes after the
 * last block it recorded.
 */
@Slf4j
public abstract class AbstractAnchorWorker implements JobWorker {

    private final AnchorProofFetcher proofFetcher;
    private final SyncProperties syncProperties;

    protected AbstractAnchorWorker(AnchorProofFetcher proofFetcher, SyncProperties syncProperties) {
        this.proofFetcher = proofFetcher;
        this.syncProperties = syncProperties;
    }

    @Override
    public void process(QueuedJob job, JobProgress progress) throws Exception {
        QueuedJob.JobData data = job.getData();
        List<String> models = job.models();
        if (models.isEmpty()) {
            log.debug("{} job {} has no models, nothing to do", job.getQueueName(), job.getId());
            return;
        }
        long from = data.getCurrentBlock() != null
                ? Math.max(data.getFromBlock(), data.getCurrentBlock() + 1)
                : data.getFromBlock();
        long chunkSize = Math.max(1L, syncProperties.getBlockChunkSize());
        int applied = 0;
        while (from <= data.getToBlock()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted at block " + from);
            }
            long to = Math.min(from + chunkSize - 1, data.getToBlock());
            for (AnchorProof proof : proofFetcher.fetch(from, to)) {
                apply(proof, models);
                applied++;
            }
            if (tracksProgress(job)) {
                progress.advanceTo(to);
            }
            from = to + 1;
        }
        log.debug("{} job {} [{}-{}] applied {} anchor proof(s)", job.getQueueName(), job.getId(),
                data.getFromBlock(), data.getToBlock(), applied);
    }

    protected abstract void apply(AnchorProof proof, List<String> models);

    protected boolean tracksProgress(QueuedJob job) {
        return true;
    }
}
