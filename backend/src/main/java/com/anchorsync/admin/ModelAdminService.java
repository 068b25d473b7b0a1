package com.anchorsync.admin;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.RpcException;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.indexing.ModelIndexService;
import com.anchorsync.sync.SyncApi;
import com.anchorsync.sync.config.SyncProperties;
import com.anchorsync.sync.status.SyncStatusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Admin operations coupling the index store with sync enrollment: a model starts syncing when it starts being
 * indexed and stops when indexing stops.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelAdminService {

    private final ModelIndexService modelIndexService;
    private final SyncApi syncApi;
    private final ChainProvider chainProvider;
    private final SyncProperties syncProperties;

    /**
     * Indexes the models and backfills the ones not yet syncing from anchorsync.sync.start-block to the confirmed tip.
     *
     * @throws RpcException if the confirmed tip cannot be read
     */
    public void startIndexingModels(List<String> models) {
        modelIndexService.indexModels(models);
        List<String> syncing = syncApi.syncedModels();
        List<String> toSync = models.stream().distinct().filter(m -> !syncing.contains(m)).toList();
        if (toSync.isEmpty()) {
            return;
        }
        long confirmedTip = chainProvider.getBlock(-syncProperties.getBlockConfirmations()).number();
        long fromBlock = Math.min(syncProperties.getStartBlock(), confirmedTip);
        syncApi.startModelSync(toSync, fromBlock, confirmedTip);
    }

    public void stopIndexingModels(List<String> models) {
        modelIndexService.stopIndexingModels(models);
        syncApi.stopModelSync(models);
    }

    public List<ModelSyncState> listModels() {
        Map<String, Integer> outstanding = syncApi.outstandingHistoricalSyncs();
        return modelIndexService.indexedModels().stream()
                .map(model -> new ModelSyncState(model, syncApi.syncComplete(model), outstanding.getOrDefault(model, 0)))
                .toList();
    }

    public void assertQueryable(String model) {
        modelIndexService.assertModelQueryable(model);
    }

    /**
     * Queues an anchor rebuild over [fromBlock, toBlock] for indexed models.
     *
     * @return id of the queued job
     */
    public String rebuild(List<String> models, long fromBlock, long toBlock) {
        models.forEach(modelIndexService::assertModelIsIndexed);
        QueuedJob job = syncApi.rebuildAnchors(models, fromBlock, toBlock);
        log.info("Queued anchor rebuild {} [{}-{}] for {}", job.getId(), fromBlock, toBlock, models);
        return job.getId();
    }

    public SyncStatusSnapshot status() {
        return syncApi.syncStatus();
    }
}
