package com.anchorsync.sync;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.NetworkInfo;
import com.anchorsync.chain.RpcException;
import com.anchorsync.chain.listener.BlockConfirmationListenerFactory;
import com.anchorsync.chain.listener.BlockListenerOptions;
import com.anchorsync.domain.BlockConfirmationEvent;
import com.anchorsync.domain.BlockHeader;
import com.anchorsync.domain.JobState;
import com.anchorsync.domain.QueuedJob;
import com.anchorsync.domain.SyncJobFinishedEvent;
import com.anchorsync.domain.SyncJobRequest;
import com.anchorsync.domain.SyncProgress;
import com.anchorsync.domain.SyncQueue;
import com.anchorsync.indexing.ModelIndexService;
import com.anchorsync.sync.config.SyncProperties;
import com.anchorsync.sync.queue.JobQueue;
import com.anchorsync.sync.queue.JobWorkers;
import com.anchorsync.sync.state.SyncStateStore;
import com.anchorsync.sync.status.SyncStatusReporter;
import com.anchorsync.sync.worker.RebuildAnchorWorker;
import com.anchorsync.sync.worker.SyncWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncApiTest {

    private static final int CONFIRMATIONS = 20;

    @Mock
    private SyncStateStore syncStateStore;
    @Mock
    private JobQueue jobQueue;
    @Mock
    private ModelIndexService modelIndexService;
    @Mock
    private SyncStatusReporter statusReporter;
    @Mock
    private BlockConfirmationListenerFactory listenerFactory;
    @Mock
    private SyncWorker syncWorker;
    @Mock
    private RebuildAnchorWorker rebuildAnchorWorker;
    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ChainProvider provider;
    @Mock
    private ScheduledFuture<?> statusLoggerFuture;

    private SyncApi syncApi;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        properties.setBlockConfirmations(CONFIRMATIONS);
        syncApi = new SyncApi(syncStateStore, jobQueue, modelIndexService, statusReporter, listenerFactory,
                syncWorker, rebuildAnchorWorker, properties, taskScheduler);
        when(jobQueue.getJobs(any(), anyCollection())).thenReturn(Map.of());
        when(listenerFactory.create(any())).thenReturn(Flux.never());
        doReturn(statusLoggerFuture).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        when(provider.getNetwork()).thenReturn(new NetworkInfo(1));
    }

    @Nested
    class Init {

        @BeforeEach
        void safeTip() {
            when(provider.getBlock(-CONFIRMATIONS)).thenReturn(new BlockHeader(10, "abc123", "parent"));
            when(modelIndexService.indexedModels()).thenReturn(List.of("m1", "m2"));
        }

        @Test
        @DisplayName("fresh state schedules catch-up from block 0 and persists the safe tip")
        void freshState_catchupFromZero() {
            when(syncStateStore.load()).thenReturn(SyncProgress.unset());

            syncApi.init(provider);

            verify(provider).getBlock(-CONFIRMATIONS);
            verify(jobQueue).addJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(0, 10, List.of("m1", "m2")));
            verify(syncStateStore).save(new SyncProgress("abc123", 10L));
            assertThat(syncApi.syncComplete("m1")).isFalse();
            assertThat(syncApi.syncedModels()).containsExactly("m1", "m2");
            assertThat(syncApi.getStartBlock()).isEqualTo(10);
            assertThat(syncApi.getCurrentBlock()).isEqualTo(30);
            assertThat(syncApi.getChainId()).isEqualTo("eip155:1");
        }

        @Test
        @DisplayName("progress behind the safe tip schedules catch-up from the processed block")
        void progressBehind_catchupFromProcessed() {
            when(syncStateStore.load()).thenReturn(new SyncProgress("h5", 5L));

            syncApi.init(provider);

            verify(jobQueue).addJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(5, 10, List.of("m1", "m2")));
        }

        @Test
        @DisplayName("progress at the safe tip schedules nothing")
        void alreadySynced_noCatchup() {
            when(syncStateStore.load()).thenReturn(new SyncProgress("abc123", 10L));

            syncApi.init(provider);

            verify(jobQueue, never()).addJob(any(), any());
            assertThat(syncApi.syncComplete("m1")).isTrue();
        }

        @Test
        @DisplayName("registers one worker per queue and subscribes from the safe tip hash")
        void registersWorkersAndSubscribes() {
            when(syncStateStore.load()).thenReturn(SyncProgress.unset());

            syncApi.init(provider);

            ArgumentCaptor<JobWorkers> workers = ArgumentCaptor.forClass(JobWorkers.class);
            verify(jobQueue).init(workers.capture());
            assertThat(workers.getValue().rebuildAnchor()).isSameAs(rebuildAnchorWorker);
            assertThat(workers.getValue().historySync()).isSameAs(syncWorker);
            assertThat(workers.getValue().continuousSync()).isSameAs(syncWorker);

            ArgumentCaptor<BlockListenerOptions> options = ArgumentCaptor.forClass(BlockListenerOptions.class);
            verify(listenerFactory).create(options.capture());
            assertThat(options.getValue().expectedParentHash()).isEqualTo("abc123");
            assertThat(options.getValue().confirmations()).isEqualTo(CONFIRMATIONS);
            assertThat(options.getValue().chainId()).isEqualTo("eip155:1");
            assertThat(options.getValue().provider()).isSameAs(provider);
            verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        }

        @Test
        @DisplayName("historical jobs left from a previous run gate their models before the queue starts")
        void restoresOutstandingHistoricalJobs() {
            when(syncStateStore.load()).thenReturn(new SyncProgress("abc123", 10L));
            when(jobQueue.getJobs(eq(JobState.CREATED), anyCollection()))
                    .thenReturn(Map.of(SyncQueue.HISTORICAL, List.of(job(SyncQueue.HISTORICAL, SyncJobRequest.catchup(0, 5, List.of("m1"))))));

            syncApi.init(provider);

            assertThat(syncApi.syncComplete("m1")).isFalse();
            assertThat(syncApi.syncComplete("m2")).isTrue();
            InOrder order = inOrder(jobQueue);
            order.verify(jobQueue).getJobs(eq(JobState.CREATED), anyCollection());
            order.verify(jobQueue).init(any());
        }

        @Test
        @DisplayName("historical job enqueued before init is counted once and released by its single finish")
        void jobEnqueuedBeforeInit_countedOnce() {
            SyncJobRequest request = SyncJobRequest.catchup(0, 10, List.of("m1"));
            QueuedJob queued = job(SyncQueue.HISTORICAL, request);
            when(jobQueue.addJob(SyncQueue.HISTORICAL, request)).thenReturn(queued);
            when(syncStateStore.load()).thenReturn(new SyncProgress("abc123", 10L));
            when(jobQueue.getJobs(eq(JobState.CREATED), anyCollection()))
                    .thenReturn(Map.of(SyncQueue.HISTORICAL, List.of(queued)));
            syncApi.startModelSync("m1", 0, 10);

            syncApi.init(provider);
            assertThat(syncApi.outstandingHistoricalSyncs()).containsExactly(Map.entry("m1", 1));

            syncApi.onSyncJobFinished(new SyncJobFinishedEvent(queued, false));
            assertThat(syncApi.syncComplete("m1")).isTrue();
        }

        @Test
        @DisplayName("chain errors while reading the safe tip are fatal")
        void chainError_fatal() {
            when(syncStateStore.load()).thenReturn(SyncProgress.unset());
            when(provider.getBlock(-CONFIRMATIONS)).thenThrow(new RpcException("down"));

            assertThatThrownBy(() -> syncApi.init(provider))
                    .isInstanceOf(SyncInitializationException.class)
                    .hasCauseInstanceOf(RpcException.class);
            verify(listenerFactory, never()).create(any());
        }

        @Test
        @DisplayName("a second init is rejected")
        void secondInit_rejected() {
            when(syncStateStore.load()).thenReturn(new SyncProgress("abc123", 10L));
            syncApi.init(provider);

            assertThatThrownBy(() -> syncApi.init(provider)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class BlockEvents {

        @BeforeEach
        void enrollModels() {
            syncApi.startModelSync(List.of("abc123", "def456"), 0, 5);
            clearInvocations(jobQueue);
        }

        @Test
        @DisplayName("confirmed block schedules a continuous job and persists progress")
        void confirmedBlock_continuousJob() {
            syncApi.handleBlockConfirmation(BlockConfirmationEvent.confirmed(new BlockHeader(10, "abc789", "p")));

            verify(jobQueue).addJob(SyncQueue.CONTINUOUS, SyncJobRequest.continuous(10, List.of("abc123", "def456")));
            verify(syncStateStore).save(new SyncProgress("abc789", 10L));
            assertThat(syncApi.syncComplete("abc123")).isFalse();
            assertThat(syncApi.getCurrentBlock()).isEqualTo(10 + CONFIRMATIONS);
        }

        @Test
        @DisplayName("reorganization re-syncs the last confirmations window")
        void reorg_fullResync() {
            syncApi.handleBlockConfirmation(BlockConfirmationEvent.reorganized(new BlockHeader(100, "abc789", "ghi789"), "ghi789"));

            verify(jobQueue).addJob(SyncQueue.HISTORICAL,
                    SyncJobRequest.full(100 - CONFIRMATIONS, 100, List.of("abc123", "def456")));
            verify(syncStateStore).save(new SyncProgress("abc789", 100L));
        }

        @Test
        @DisplayName("reorganization near genesis starts the window at block 0")
        void reorgNearGenesis_clampedAtZero() {
            syncApi.handleBlockConfirmation(BlockConfirmationEvent.reorganized(new BlockHeader(5, "h5", "x"), "x"));

            verify(jobQueue).addJob(SyncQueue.HISTORICAL, SyncJobRequest.full(0, 5, List.of("abc123", "def456")));
        }

        @Test
        @DisplayName("progress is persisted even when scheduling fails")
        void schedulingFails_progressStillPersisted() {
            when(jobQueue.addJob(any(), any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

            syncApi.handleBlockConfirmation(BlockConfirmationEvent.reorganized(new BlockHeader(50, "h50", "x"), "x"));

            verify(syncStateStore).save(new SyncProgress("h50", 50L));
            assertThat(syncApi.outstandingHistoricalSyncs()).containsEntry("abc123", 1);
        }

        @Test
        @DisplayName("failing to persist progress does not escape the handler")
        void persistFails_noException() {
            doThrow(new DataAccessResourceFailureException("mongo down")).when(syncStateStore).save(any());

            syncApi.handleBlockConfirmation(BlockConfirmationEvent.confirmed(new BlockHeader(11, "h11", "p")));

            verify(jobQueue).addJob(eq(SyncQueue.CONTINUOUS), any());
        }
    }

    @Nested
    class Concurrency {

        private static final int THREADS = 8;

        private final ExecutorService executor = Executors.newFixedThreadPool(THREADS);

        @AfterEach
        void shutdownExecutor() {
            executor.shutdownNow();
        }

        @Test
        @DisplayName("block handlers never overlap and each persists progress after submitting its job")
        void blockHandlers_serialized() throws Exception {
            syncApi.startModelSync("m1", 0, 5);
            CountDownLatch allArrived = new CountDownLatch(THREADS);
            AtomicInteger inHandler = new AtomicInteger();
            AtomicInteger maxInHandler = new AtomicInteger();
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            when(jobQueue.addJob(eq(SyncQueue.CONTINUOUS), any())).thenAnswer(inv -> {
                maxInHandler.accumulateAndGet(inHandler.incrementAndGet(), Math::max);
                allArrived.await(5, TimeUnit.SECONDS);
                SyncJobRequest request = inv.getArgument(1);
                events.add("job:" + request.fromBlock());
                return null;
            });
            doAnswer(inv -> {
                SyncProgress progress = inv.getArgument(0);
                events.add("save:" + progress.processedBlockNumber());
                inHandler.decrementAndGet();
                return null;
            }).when(syncStateStore).save(any());

            List<Future<?>> handlers = new ArrayList<>();
            for (int i = 1; i <= THREADS; i++) {
                long block = 100 + i;
                handlers.add(executor.submit(() -> {
                    allArrived.countDown();
                    syncApi.handleBlockConfirmation(
                            BlockConfirmationEvent.confirmed(new BlockHeader(block, "h" + block, "p")));
                }));
            }
            for (Future<?> handler : handlers) {
                handler.get(10, TimeUnit.SECONDS);
            }

            assertThat(maxInHandler.get()).isEqualTo(1);
            assertThat(events).hasSize(2 * THREADS);
            for (int i = 0; i < events.size(); i += 2) {
                String block = events.get(i).substring("job:".length());
                assertThat(events.get(i + 1)).isEqualTo("save:" + block);
            }
        }

        @Test
        @DisplayName("concurrent enqueues and finishes leave the gate consistent")
        void concurrentEnqueueAndFinish_counterConsistent() throws Exception {
            SyncJobRequest request = SyncJobRequest.full(1, 10, List.of("m1"));
            QueuedJob queued = job(SyncQueue.HISTORICAL, request);
            when(jobQueue.addJob(SyncQueue.HISTORICAL, request)).thenReturn(queued);
            int rounds = 200;
            CountDownLatch start = new CountDownLatch(1);

            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                workers.add(executor.submit(() -> {
                    start.await();
                    for (int r = 0; r < rounds; r++) {
                        syncApi.addSyncJob(SyncQueue.HISTORICAL, request);
                        assertThat(syncApi.syncComplete("m1")).isFalse();
                        syncApi.onSyncJobFinished(new SyncJobFinishedEvent(queued, false));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }

            assertThat(syncApi.outstandingHistoricalSyncs()).isEmpty();
            assertThat(syncApi.syncComplete("m1")).isTrue();
        }
    }

    @Nested
    class Enrollment {

        @Test
        @DisplayName("single model and one-element list enroll identically")
        void singleAndListEquivalent() {
            syncApi.startModelSync("abc123", 1, 10);

            verify(jobQueue).addJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(1, 10, List.of("abc123")));
            assertThat(syncApi.syncedModels()).containsExactly("abc123");

            syncApi.startModelSync(List.of("abc123"), 1, 10);
            assertThat(syncApi.syncedModels()).containsExactly("abc123");
        }

        @Test
        @DisplayName("multiple models go into one historical job")
        void multipleModels_oneJob() {
            syncApi.startModelSync(List.of("abc123", "def456"), 1, 10);

            verify(jobQueue).addJob(SyncQueue.HISTORICAL, SyncJobRequest.catchup(1, 10, List.of("abc123", "def456")));
            assertThat(syncApi.syncedModels()).containsExactly("abc123", "def456");
        }

        @Test
        @DisplayName("stopModelSync removes single and multiple models; absent models are ignored")
        void stopModelSync() {
            syncApi.startModelSync(List.of("abc123", "def456", "efg456"), 1, 10);

            syncApi.stopModelSync("abc123");
            assertThat(syncApi.syncedModels()).containsExactly("def456", "efg456");

            syncApi.stopModelSync(List.of("def456", "efg456"));
            assertThat(syncApi.syncedModels()).isEmpty();

            syncApi.stopModelSync("missing");
            assertThat(syncApi.syncedModels()).isEmpty();
        }

        @Test
        @DisplayName("historical job gates its models until the finish event")
        void historicalJob_gatesUntilFinished() {
            SyncJobRequest request = SyncJobRequest.full(1, 10, List.of("abc123"));
            QueuedJob queued = job(SyncQueue.HISTORICAL, request);
            when(jobQueue.addJob(SyncQueue.HISTORICAL, request)).thenReturn(queued);

            syncApi.addSyncJob(SyncQueue.HISTORICAL, request);
            assertThat(syncApi.syncComplete("abc123")).isFalse();

            syncApi.onSyncJobFinished(new SyncJobFinishedEvent(queued, false));
            assertThat(syncApi.syncComplete("abc123")).isTrue();
        }

        @Test
        @DisplayName("terminal failure still releases the gate")
        void failedJob_releasesGate() {
            SyncJobRequest request = SyncJobRequest.catchup(1, 10, List.of("abc123"));
            syncApi.addSyncJob(SyncQueue.HISTORICAL, request);

            syncApi.onSyncJobFinished(new SyncJobFinishedEvent(job(SyncQueue.HISTORICAL, request), true));

            assertThat(syncApi.syncComplete("abc123")).isTrue();
        }

        @Test
        @DisplayName("continuous and rebuild jobs never gate models")
        void nonHistoricalJobs_doNotGate() {
            syncApi.addSyncJob(SyncQueue.CONTINUOUS, SyncJobRequest.continuous(3, List.of("abc123")));
            syncApi.rebuildAnchors(List.of("abc123"), 0, 3);

            verify(jobQueue).addJob(SyncQueue.REBUILD, SyncJobRequest.full(0, 3, List.of("abc123")));
            assertThat(syncApi.syncComplete("abc123")).isTrue();
        }

        @Test
        @DisplayName("a failed enqueue does not leave the model gated")
        void failedEnqueue_rollsBackCounter() {
            when(jobQueue.addJob(any(), any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

            assertThatThrownBy(() -> syncApi.startModelSync("abc123", 1, 10))
                    .isInstanceOf(DataAccessResourceFailureException.class);
            assertThat(syncApi.syncComplete("abc123")).isTrue();
        }
    }

    @Test
    @DisplayName("syncStatus passes start block, estimated head and synced models to the reporter")
    void syncStatus_delegatesToReporter() {
        syncApi.startModelSync("m1", 0, 1);
        syncApi.setBlockRange(400, 499);

        syncApi.syncStatus();

        verify(statusReporter).report(400, 499, List.of("m1"));
    }

    @Test
    @DisplayName("status logging failures are swallowed")
    void logSyncStatus_swallowsFailures() {
        when(statusReporter.report(anyLong(), anyLong(), any())).thenThrow(new IllegalStateException("boom"));

        syncApi.logSyncStatus();

        verify(statusReporter, never()).logStatus(any());
    }

    @Test
    @DisplayName("shutdown disposes the subscription, cancels the status logger and stops the queue")
    void shutdown_releasesEverything() {
        Disposable subscription = mock(Disposable.class);
        syncApi.setSubscription(subscription);
        syncApi.setPeriodicStatusLogger(statusLoggerFuture);

        syncApi.shutdown();

        verify(subscription).dispose();
        verify(statusLoggerFuture).cancel(false);
        verify(jobQueue).stop();
    }

    @Test
    @DisplayName("shutdown still stops the queue when disposing the subscription fails")
    void shutdown_continuesAfterFailure() {
        Disposable subscription = mock(Disposable.class);
        doThrow(new IllegalStateException("dispose failed")).when(subscription).dispose();
        syncApi.setSubscription(subscription);
        syncApi.setPeriodicStatusLogger(statusLoggerFuture);

        assertThatThrownBy(() -> syncApi.shutdown()).isInstanceOf(IllegalStateException.class);

        verify(statusLoggerFuture).cancel(false);
        verify(jobQueue).stop();
    }

    private static QueuedJob job(SyncQueue queue, SyncJobRequest request) {
        QueuedJob job = QueuedJob.created(queue, request, Instant.now());
        job.setId("job-" + request.fromBlock() + "-" + request.toBlock());
        return job;
    }
}
