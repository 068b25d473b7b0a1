package com.anchorsync.sync.status;

import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.SyncQueue;
import com.anchorsync.sync.config.SyncProperties;
import com.anchorsync.sync.queue.JobQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds {@link SyncStatusSnapshot}s from the job queue and renders them for the periodic status log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncStatusReporter {

    private static final List<SyncQueue> ACTIVE_QUEUES = List.of(SyncQueue.HISTORICAL, SyncQueue.CONTINUOUS);
    private static final List<SyncQueue> PENDING_QUEUES = List.of(SyncQueue.HISTORICAL);

    private final JobQueue jobQueue;
    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;

    /**
     * @param startBlock   confirmed tip the engine started from
     * @param currentBlock estimated chain head
     * @param syncedModels models enrolled for continuous sync
     */
    public SyncStatusSnapshot report(long startBlock, long currentBlock, List<String> syncedModels) {
        Map<SyncQueue, List<QueuedJob>> active = jobQueue.getJobs(JobState.ACTIVE, ACTIVE_QUEUES);
        Map<SyncQueue, List<QueuedJob>> created = jobQueue.getJobs(JobState.CREATED, PENDING_QUEUES);

        List<SyncStatusSnapshot.ActiveSync> activeSyncs = active.getOrDefault(SyncQueue.HISTORICAL, List.of()).stream()
                .map(job -> new SyncStatusSnapshot.ActiveSync(job.models(), job.getData().getFromBlock(),
                        job.getData().getCurrentBlock(), job.getData().getToBlock(), job.getStartedOn(), job.getCreatedOn()))
                .toList();
        List<SyncStatusSnapshot.PendingSync> pendingSyncs = created.getOrDefault(SyncQueue.HISTORICAL, List.of()).stream()
                .map(job -> new SyncStatusSnapshot.PendingSync(job.models(), job.getData().getFromBlock(),
                        job.getData().getToBlock(), job.getCreatedOn()))
                .toList();

        int confirmations = syncProperties.getBlockConfirmations();
        List<QueuedJob> continuous = active.getOrDefault(SyncQueue.CONTINUOUS, List.of());
        SyncStatusSnapshot.ContinuousSync continuousSync;
        if (!continuous.isEmpty()) {
            QueuedJob job = continuous.get(0);
            continuousSync = new SyncStatusSnapshot.ContinuousSync(startBlock, job.getData().getFromBlock(),
                    currentBlock, confirmations, job.models());
        } else {
            continuousSync = new SyncStatusSnapshot.ContinuousSync(startBlock, currentBlock - confirmations,
                    currentBlock, confirmations, List.copyOf(syncedModels));
        }
        return new SyncStatusSnapshot(activeSyncs, pendingSyncs, List.of(continuousSync));
    }

    public void logStatus(SyncStatusSnapshot snapshot) {
        try {
            log.info("Anchor sync status: {}", objectMapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            log.warn("Could not render sync status: {}", e.getMessage());
        }
    }
}
