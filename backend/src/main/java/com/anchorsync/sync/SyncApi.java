package com.anchorsync.sync;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.NetworkInfo;
import com.anchorsync.chain.listener.BlockConfirmationListenerFactory;
import com.anchorsync.chain.listener.BlockListenerOptions;
import com.anchorsync.config.SchedulerConfig;
import com.anchorsync.domain.BlockConfirmationEvent;
import com.anchorsync.domain.BlockHeader;
import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.SyncJobFinishedEvent;
import com.anchorsync.domain.SyncJobRequest;
import com.anchorsync.domain.SyncProgress;
import com.anchorsync.domain.SyncQueue;
import com.anchorsync.indexing.ModelIndexService;
import com.anchorsync.indexing.SyncQueryApi;
import com.anchorsync.sync.config.SyncProperties;
import com.anchorsync.sync.queue.JobQueue;
import com.anchorsync.sync.queue.JobWorkers;
import com.anchorsync.sync.state.HistoricSyncCounter;
import com.anchorsync.sync.state.ModelSyncSet;
import com.anchorsync.sync.state.SyncStateStore;
import com.anchorsync.sync.status.SyncStatusReporter;
import com.anchorsync.sync.status.SyncStatusSnapshot;
import com.anchorsync.sync.worker.RebuildAnchorWorker;
import com.anchorsync.sync.worker.SyncWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anchor sync orchestrator. Keeps the enrolled models and their outstanding historical syncs, turns confirmed blocks
 * into sync jobs, persists progress and answers readiness and status queries.
 *
 * <p>Block events are handled one at a time under {@link #blockLock}: a handler only enqueues a job and writes
 * progress, the anchor work itself runs on the job queue.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncApi implements SyncQueryApi {

    private final SyncStateStore syncStateStore;
    private final JobQueue jobQueue;
    private final ModelIndexService modelIndexService;
    private final SyncStatusReporter statusReporter;
    private final BlockConfirmationListenerFactory listenerFactory;
    private final SyncWorker syncWorker;
    private final RebuildAnchorWorker rebuildAnchorWorker;
    private final SyncProperties syncProperties;
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    private final TaskScheduler taskScheduler;

    private final ReentrantLock blockLock = new ReentrantLock();
    private final Object enqueueLock = new Object();
    private final ModelSyncSet modelsToSync = new ModelSyncSet();
    private final HistoricSyncCounter modelsToHistoricSync = new HistoricSyncCounter();
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    private volatile String chainId;
    private volatile long startBlock;
    private volatile long currentBlock;
    private volatile Disposable subscription;
    private volatile ScheduledFuture<?> periodicStatusLogger;

    /**
     * Starts syncing against the given chain: schedules catch-up from the stored progress to the confirmed tip,
     * then follows new confirmed blocks.
     *
     * @throws SyncInitializationException if the confirmed tip or network cannot be read
     */
    public void init(ChainProvider provider) {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Sync already initialized");
        }
        int confirmations = syncProperties.getBlockConfirmations();
        SyncProgress progress = syncStateStore.load();
        initModelsToSync();
        restoreHistoricSyncCounters();
        jobQueue.init(new JobWorkers(rebuildAnchorWorker, syncWorker, syncWorker));

        BlockHeader safeTip;
        NetworkInfo network;
        try {
            safeTip = provider.getBlock(-confirmations);
            network = provider.getNetwork();
        } catch (RuntimeException e) {
            throw new SyncInitializationException("Cannot read confirmed chain tip: " + e.getMessage(), e);
        }
        chainId = network.caip2();
        startBlock = safeTip.number();
        currentBlock = safeTip.number() + confirmations;

        blockLock.lock();
        try {
            scheduleCatchup(progress, safeTip);
            saveProgress(SyncProgress.of(safeTip));
        } finally {
            blockLock.unlock();
        }

        initBlockSubscription(provider, safeTip.hash());
        initPeriodicStatusLogger();
        log.info("Anchor sync started on {} at block {} for {} model(s)", chainId, startBlock, modelsToSync.size());
    }

    private void initModelsToSync() {
        List<String> models = modelIndexService.indexedModels();
        modelsToSync.addAll(models);
    }

    /** Historical jobs that survived a restart still gate their models. */
    /**
     * Rebuilds the historic counters from the queue's outstanding historical jobs. Jobs enqueued earlier in this
     * run are in the queue too, so the counts are replaced rather than added to.
     */
    private void restoreHistoricSyncCounters() {
        List<SyncQueue> historical = List.of(SyncQueue.HISTORICAL);
        synchronized (enqueueLock) {
            Map<String, Integer> outstanding = new HashMap<>();
            int restored = 0;
            for (JobState state : List.of(JobState.CREATED, JobState.ACTIVE)) {
                for (QueuedJob job : jobQueue.getJobs(state, historical).getOrDefault(SyncQueue.HISTORICAL, List.of())) {
                    job.models().forEach(model -> outstanding.merge(model, 1, Integer::sum));
                    restored++;
                }
            }
            modelsToHistoricSync.replaceAll(outstanding);
            if (restored > 0) {
                log.info("Restored {} outstanding historical sync job(s)", restored);
            }
        }
    }

    private void scheduleCatchup(SyncProgress progress, BlockHeader safeTip) {
        List<String> models = modelsToSync.snapshot();
        if (progress.isUnset()) {
            log.info("No sync progress stored, scheduling catch-up [0-{}]", safeTip.number());
            addSyncJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(0, safeTip.number(), models));
        } else if (progress.processedBlockNumber() < safeTip.number()) {
            log.info("Scheduling catch-up [{}-{}]", progress.processedBlockNumber(), safeTip.number());
            addSyncJob(SyncQueue.HISTORICAL,
                    SyncJobRequest.catchup(progress.processedBlockNumber(), safeTip.number(), models));
        } else {
            log.info("Already synced to block {}, no catch-up needed", progress.processedBlockNumber());
        }
    }

    private void initBlockSubscription(ChainProvider provider, String expectedParentHash) {
        BlockListenerOptions options = new BlockListenerOptions(
                syncProperties.getBlockConfirmations(), chainId, provider, expectedParentHash);
        subscription = listenerFactory.create(options)
                .subscribe(this::handleBlockConfirmation,
                        e -> log.error("Block subscription on {} terminated", chainId, e));
    }

    private void initPeriodicStatusLogger() {
        long intervalMs = Math.max(1L, syncProperties.getStatusLogIntervalMs());
        periodicStatusLogger = taskScheduler.scheduleAtFixedRate(this::logSyncStatus, Duration.ofMillis(intervalMs));
    }

    /**
     * Schedules the work for one confirmed block and records it as processed. Never throws: a scheduling failure
     * is logged and progress is still written.
     */
    public void handleBlockConfirmation(BlockConfirmationEvent event) {
        BlockHeader block = event.block();
        int confirmations = syncProperties.getBlockConfirmations();
        blockLock.lock();
        try {
            currentBlock = block.number() + confirmations;
            List<String> models = modelsToSync.snapshot();
            try {
                if (event.reorganized()) {
                    long fromBlock = Math.max(0, block.number() - confirmations);
                    log.warn("Reorganization at block {} (new parent {}), resyncing [{}-{}]",
                            block.number(), event.expectedParentHash(), fromBlock, block.number());
                    addSyncJob(SyncQueue.HISTORICAL, SyncJobRequest.full(fromBlock, block.number(), models));
                } else {
                    log.debug("Block {} confirmed, scheduling continuous sync", block.number());
                    addSyncJob(SyncQueue.CONTINUOUS, SyncJobRequest.continuous(block.number(), models));
                }
            } catch (RuntimeException e) {
                log.error("Failed to schedule sync job for block {}", block.number(), e);
            }
            saveProgress(SyncProgress.of(block));
        } finally {
            blockLock.unlock();
        }
    }

    private void saveProgress(SyncProgress progress) {
        try {
            syncStateStore.save(progress);
        } catch (RuntimeException e) {
            log.error("Failed to persist sync progress at block {}", progress.processedBlockNumber(), e);
        }
    }

    public void startModelSync(String model, long fromBlock, long toBlock) {
        startModelSync(List.of(model), fromBlock, toBlock);
    }

    /**
     * Enrolls the models for continuous sync and backfills them over [fromBlock, toBlock].
     */
    public void startModelSync(Collection<String> models, long fromBlock, long toBlock) {
        List<String> normalized = List.copyOf(models);
        modelsToSync.addAll(normalized);
        log.info("Starting sync for {} model(s) over [{}-{}]", normalized.size(), fromBlock, toBlock);
        addSyncJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(fromBlock, toBlock, normalized));
    }

    public void stopModelSync(String model) {
        stopModelSync(List.of(model));
    }

    /** Stops scheduling new work for the models. Jobs already queued run to completion. */
    public void stopModelSync(Collection<String> models) {
        List<String> removed = modelsToSync.removeAll(models);
        if (!removed.isEmpty()) {
            log.info("Stopped sync for models: {}", String.join(",", removed));
        }
    }

    /** Re-applies all anchors of [fromBlock, toBlock] for the models. */
    public QueuedJob rebuildAnchors(Collection<String> models, long fromBlock, long toBlock) {
        return addSyncJob(SyncQueue.REBUILD, SyncJobRequest.full(fromBlock, toBlock, List.copyOf(models)));
    }

    /**
     * Enqueues a job. Historical jobs count against their models' readiness; the count is taken before the job is
     * visible to workers so a fast completion can never be decremented first.
     */
    public QueuedJob addSyncJob(SyncQueue queue, SyncJobRequest request) {
        if (queue != SyncQueue.HISTORICAL) {
            return jobQueue.addJob(queue, request);
        }
        synchronized (enqueueLock) {
            modelsToHistoricSync.increment(request.models());
            try {
                return jobQueue.addJob(queue, request);
            } catch (RuntimeException e) {
                modelsToHistoricSync.decrement(request.models());
                throw e;
            }
        }
    }

    @EventListener
    public void onSyncJobFinished(SyncJobFinishedEvent event) {
        QueuedJob job = event.job();
        if (job.getQueue() != SyncQueue.HISTORICAL) {
            return;
        }
        if (event.failed()) {
            log.error("Historical sync job {} [{}-{}] failed permanently; models {} may be incomplete",
                    job.getId(), job.getData().getFromBlock(), job.getData().getToBlock(), job.models());
        }
        modelsToHistoricSync.decrement(job.models());
    }

    @Override
    public boolean syncComplete(String model) {
        return modelsToHistoricSync.isSynced(model);
    }

    public SyncStatusSnapshot syncStatus() {
        return statusReporter.report(startBlock, currentBlock, modelsToSync.snapshot());
    }

    void logSyncStatus() {
        try {
            statusReporter.logStatus(syncStatus());
        } catch (RuntimeException e) {
            log.warn("Sync status logging failed: {}", e.getMessage());
        }
    }

    /**
     * Stops following blocks, waits for an in-flight block handler and stops the job queue. Each step runs even
     * if an earlier one fails.
     */
    public void shutdown() {
        try {
            Disposable s = subscription;
            if (s != null) {
                s.dispose();
            }
        } finally {
            try {
                ScheduledFuture<?> logger = periodicStatusLogger;
                if (logger != null) {
                    logger.cancel(false);
                }
            } finally {
                blockLock.lock();
                try {
                    jobQueue.stop();
                } finally {
                    blockLock.unlock();
                }
            }
        }
        log.info("Anchor sync stopped");
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public List<String> syncedModels() {
        return modelsToSync.snapshot();
    }

    public Map<String, Integer> outstandingHistoricalSyncs() {
        return modelsToHistoricSync.snapshot();
    }

    public long getStartBlock() {
        return startBlock;
    }

    public long getCurrentBlock() {
        return currentBlock;
    }

    public String getChainId() {
        return chainId;
    }

    void setBlockRange(long startBlock, long currentBlock) {
        this.startBlock = startBlock;
        this.currentBlock = currentBlock;
    }

    void setSubscription(Disposable subscription) {
        this.subscription = subscription;
    }

    void setPeriodicStatusLogger(ScheduledFuture<?> periodicStatusLogger) {
        this.periodicStatusLogger = periodicStatusLogger;
    }
}
