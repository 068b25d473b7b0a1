package com.anchorsync.sync.queue;

import com.anchorsync.common.RetryPolicy;
import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.QueuedJobRepository;
import com.anchorsync.domain.SyncJobFinishedEvent;
import com.anchorsync.domain.SyncJobRequest;
import com.anchorsync.domain.SyncQueue;
import com.anchorsync.sync.config.JobQueueProperties;
import com.anchorsync.sync.config.SyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * {@link JobQueue} over the sync_jobs collection. Each queue gets its own worker loops on its own executor;
 * a loop claims the oldest runnable job atomically, runs it and records the outcome. Failed attempts go back to
 * CREATED with exponential backoff until max attempts, then FAILED.
 */
@Component
@Slf4j
public class MongoJobQueue implements JobQueue {

    private final QueuedJobRepository jobRepository;
    private final JobQueueProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<SyncQueue, Executor> executors;
    private final RetryPolicy retryPolicy;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile CountDownLatch loopsRunning = new CountDownLatch(0);
    private final Map<String, Instant> inFlight = new ConcurrentHashMap<>();

    public MongoJobQueue(QueuedJobRepository jobRepository,
                         JobQueueProperties properties,
                         ApplicationEventPublisher eventPublisher,
                         @Qualifier(SyncConfig.HISTORY_SYNC_EXECUTOR) Executor historySyncExecutor,
                         @Qualifier(SyncConfig.CONTINUOUS_SYNC_EXECUTOR) Executor continuousSyncExecutor,
                         @Qualifier(SyncConfig.REBUILD_ANCHOR_EXECUTOR) Executor rebuildAnchorExecutor) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.executors = new EnumMap<>(SyncQueue.class);
        this.executors.put(SyncQueue.HISTORICAL, historySyncExecutor);
        this.executors.put(SyncQueue.CONTINUOUS, continuousSyncExecutor);
        this.executors.put(SyncQueue.REBUILD, rebuildAnchorExecutor);
        this.retryPolicy = new RetryPolicy(properties.getRetryBaseDelayMs(), properties.getRetryMaxDelayMs(),
                properties.getRetryJitterFactor(), properties.getMaxAttempts());
    }

    @Override
    public void init(JobWorkers workers) {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Job queue already initialized");
        }
        Instant now = Instant.now();
        long requeued = jobRepository.requeueStaleActive(now, now);
        if (requeued > 0) {
            log.info("Requeued {} job(s) left active by a previous run", requeued);
        }
        int total = 0;
        for (SyncQueue queue : SyncQueue.values()) {
            total += properties.workersFor(queue);
        }
        loopsRunning = new CountDownLatch(total);
        running.set(true);
        for (SyncQueue queue : SyncQueue.values()) {
            JobWorker worker = workers.forQueue(queue);
            int n = properties.workersFor(queue);
            for (int i = 0; i < n; i++) {
                executors.get(queue).execute(() -> workerLoop(queue, worker));
            }
            log.info("Job queue {}: {} worker loop(s) started", queue.queueName(), n);
        }
    }

    @Override
    public QueuedJob addJob(SyncQueue queue, SyncJobRequest request) {
        QueuedJob saved = jobRepository.save(QueuedJob.created(queue, request, Instant.now()));
        log.debug("Queued {} job {} [{}-{}] for {} model(s)", queue.queueName(), saved.getId(),
                request.fromBlock(), request.toBlock(), request.models().size());
        return saved;
    }

    @Override
    public Map<SyncQueue, List<QueuedJob>> getJobs(JobState state, Collection<SyncQueue> queues) {
        Map<SyncQueue, List<QueuedJob>> byQueue = new EnumMap<>(SyncQueue.class);
        for (SyncQueue queue : queues) {
            byQueue.put(queue, List.of());
        }
        if (queues.isEmpty()) {
            return byQueue;
        }
        Map<SyncQueue, List<QueuedJob>> found = jobRepository.findByStateAndQueueInOrderByCreatedOnAsc(state, queues)
                .stream()
                .collect(Collectors.groupingBy(QueuedJob::getQueue));
        found.forEach((queue, jobs) -> byQueue.put(queue, List.copyOf(jobs)));
        return byQueue;
    }

    @Override
    public void updateCurrentBlock(String jobId, long block) {
        jobRepository.updateCurrentBlock(jobId, block, Instant.now());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopSignal.countDown();
        try {
            if (!loopsRunning.await(properties.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Job queue stop timed out after {} ms with jobs still running; they will be requeued on next start",
                        properties.getShutdownTimeoutMs());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        log.info("Job queue stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void workerLoop(SyncQueue queue, JobWorker worker) {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                Optional<QueuedJob> next;
                try {
                    next = jobRepository.claimNext(queue, Instant.now());
                } catch (RuntimeException e) {
                    log.warn("Claiming from {} failed: {}", queue.queueName(), e.getMessage());
                    next = Optional.empty();
                }
                if (next.isPresent()) {
                    runJob(next.get(), worker);
                    continue;
                }
                if (stopSignal.await(properties.getPollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} worker loop interrupted", queue.queueName());
        } finally {
            loopsRunning.countDown();
        }
    }

    void runJob(QueuedJob job, JobWorker worker) {
        Instant claimedAt = job.getStartedOn();
        inFlight.put(job.getId(), claimedAt);
        try {
            runClaimed(job, claimedAt, worker);
        } finally {
            inFlight.remove(job.getId(), claimedAt);
        }
    }

    private void runClaimed(QueuedJob job, Instant claimedAt, JobWorker worker) {
        try {
            worker.process(job, block -> {
                job.getData().setCurrentBlock(block);
                if (!jobRepository.updateClaimedCurrentBlock(job.getId(), claimedAt, block, Instant.now())) {
                    log.warn("{} job {} lost its claim at block {}", job.getQueueName(), job.getId(), block);
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requeue(job, claimedAt);
            return;
        } catch (Exception e) {
            try {
                recordFailure(job, claimedAt, e);
            } catch (RuntimeException persistFailure) {
                log.error("Could not record failure of job {}; it will be reclaimed when stale", job.getId(), persistFailure);
            }
            return;
        }
        try {
            markCompleted(job, claimedAt);
        } catch (RuntimeException e) {
            log.error("Could not mark job {} completed; it will be reclaimed when stale", job.getId(), e);
        }
    }

    private void markCompleted(QueuedJob job, Instant claimedAt) {
        job.setState(JobState.COMPLETED);
        job.setCompletedOn(Instant.now());
        if (!release(job, claimedAt)) {
            return;
        }
        log.debug("{} job {} completed", job.getQueueName(), job.getId());
        eventPublisher.publishEvent(new SyncJobFinishedEvent(job, false));
    }

    private void recordFailure(QueuedJob job, Instant claimedAt, Exception cause) {
        int attempts = job.getAttempts() + 1;
        Instant now = Instant.now();
        job.setAttempts(attempts);
        job.setLastError(cause.getMessage());
        if (retryPolicy.canRetry(attempts)) {
            long delayMs = retryPolicy.delayMs(attempts - 1);
            job.setState(JobState.CREATED);
            job.setStartAfter(now.plusMillis(delayMs));
            job.setStartedOn(null);
            job.setHeartbeatAt(null);
            if (release(job, claimedAt)) {
                log.warn("{} job {} failed (attempt {}/{}), retrying in {} ms: {}", job.getQueueName(), job.getId(),
                        attempts, retryPolicy.getMaxAttempts(), delayMs, cause.getMessage());
            }
            return;
        }
        job.setState(JobState.FAILED);
        job.setCompletedOn(now);
        if (!release(job, claimedAt)) {
            return;
        }
        log.error("{} job {} FAILED after {} attempts", job.getQueueName(), job.getId(), attempts, cause);
        eventPublisher.publishEvent(new SyncJobFinishedEvent(job, true));
    }

    private void requeue(QueuedJob job, Instant claimedAt) {
        job.setState(JobState.CREATED);
        job.setStartAfter(Instant.now());
        job.setStartedOn(null);
        job.setHeartbeatAt(null);
        try {
            release(job, claimedAt);
        } catch (RuntimeException e) {
            log.warn("Could not requeue interrupted job {}; it will be reclaimed when stale", job.getId());
        }
    }

    /** Stores the outcome only if this run still holds the job; a reclaimed job belongs to its new worker. */
    private boolean release(QueuedJob job, Instant claimedAt) {
        if (jobRepository.releaseClaim(job, claimedAt)) {
            return true;
        }
        log.warn("{} job {} was reclaimed while running; dropping {} outcome of the stale run",
                job.getQueueName(), job.getId(), job.getState());
        return false;
    }

    /** Keeps the heartbeat of jobs running in this process fresh, independent of how long a chunk takes. */
    @Scheduled(fixedDelayString = "${anchorsync.jobs.heartbeat-interval-ms:30000}")
    public void refreshHeartbeats() {
        if (inFlight.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        inFlight.forEach((jobId, claimedAt) -> {
            try {
                if (!jobRepository.touchHeartbeat(jobId, claimedAt, now)) {
                    log.warn("Job {} is no longer held by this worker", jobId);
                }
            } catch (RuntimeException e) {
                log.warn("Heartbeat of job {} failed: {}", jobId, e.getMessage());
            }
        });
    }

    /** Gives jobs whose worker died (no heartbeat for stale-active-after-ms) back to their queue. */
    @Scheduled(fixedDelayString = "${anchorsync.jobs.reclaim-interval-ms:60000}")
    public void reclaimStaleJobs() {
        if (!running.get()) {
            return;
        }
        Instant now = Instant.now();
        long requeued = jobRepository.requeueStaleActive(now.minus(Duration.ofMillis(properties.getStaleActiveAfterMs())), now);
        if (requeued > 0) {
            log.warn("Requeued {} stale active job(s)", requeued);
        }
    }

    /** TTL cleanup of COMPLETED/FAILED jobs older than retention-hours. Runs every hour. */
    @Scheduled(fixedRate = 3600_000)
    public void deleteExpiredJobs() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(properties.getRetentionHours()));
        long deleted = jobRepository.deleteByStateInAndCompletedOnBefore(Set.of(JobState.COMPLETED, JobState.FAILED), cutoff);
        if (deleted > 0) {
            log.info("Deleted {} expired job(s) completed before {}", deleted, cutoff);
        }
    }
}
