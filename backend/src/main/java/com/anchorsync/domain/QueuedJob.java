package com.anchorsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A job record in sync_jobs. {@code data} mirrors {@link SyncJobRequest} plus the worker-maintained currentBlock
 * cursor; everything else is queue bookkeeping.
 */
@Document(collection = "sync_jobs")
@CompoundIndexes({
        @CompoundIndex(name = "queue_state_start", def = "{'queue': 1, 'state': 1, 'startAfter': 1, 'createdOn': 1}"),
        @CompoundIndex(name = "state_completed", def = "{'state': 1, 'completedOn': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class QueuedJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private SyncQueue queue;
    private JobState state;
    private JobData data;
    private int attempts;
    private String lastError;
    private Instant startAfter;
    private Instant heartbeatAt;
    private Instant createdOn;
    private Instant startedOn;
    private Instant completedOn;

    public static QueuedJob created(SyncQueue queue, SyncJobRequest request, Instant now) {
        QueuedJob job = new QueuedJob();
        job.setQueue(queue);
        job.setState(JobState.CREATED);
        job.setData(JobData.from(request));
        job.setStartAfter(now);
        job.setCreatedOn(now);
        return job;
    }

    public String getQueueName() {
        return queue != null ? queue.queueName() : null;
    }

    public List<String> models() {
        return data != null && data.getModels() != null ? data.getModels() : List.of();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class JobData {
        private SyncJobKind jobType;
        private long fromBlock;
        private long toBlock;
        private List<String> models = new ArrayList<>();
        /** Last block the worker finished; null until the first chunk is done. */
        private Long currentBlock;

        public static JobData from(SyncJobRequest request) {
            JobData data = new JobData();
            data.setJobType(request.jobType());
            data.setFromBlock(request.fromBlock());
            data.setToBlock(request.toBlock());
            data.setModels(new ArrayList<>(request.models()));
            return data;
        }

        public SyncJobRequest toRequest() {
            return new SyncJobRequest(jobType, fromBlock, toBlock, models);
        }
    }
}
