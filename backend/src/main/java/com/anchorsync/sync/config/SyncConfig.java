package com.anchorsync.sync.config;

import com.anchorsync.domain.SyncQueue;
import com.anchorsync.sync.worker.AnchorProofHandler;
import com.anchorsync.sync.worker.LoggingAnchorProofHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools for the job queue worker loops, one per queue, each sized to its worker count.
 */
@Configuration
@EnableConfigurationProperties({ SyncProperties.class, JobQueueProperties.class })
public class SyncConfig {

    public static final String HISTORY_SYNC_EXECUTOR = "history-sync-executor";
    public static final String CONTINUOUS_SYNC_EXECUTOR = "continuous-sync-executor";
    public static final String REBUILD_ANCHOR_EXECUTOR = "rebuild-anchor-executor";

    @Bean(name = HISTORY_SYNC_EXECUTOR)
    public Executor historySyncExecutor(JobQueueProperties properties) {
        return executor(properties.workersFor(SyncQueue.HISTORICAL), "history-sync-");
    }

    @Bean(name = CONTINUOUS_SYNC_EXECUTOR)
    public Executor continuousSyncExecutor(JobQueueProperties properties) {
        return executor(properties.workersFor(SyncQueue.CONTINUOUS), "continuous-sync-");
    }

    @Bean(name = REBUILD_ANCHOR_EXECUTOR)
    public Executor rebuildAnchorExecutor(JobQueueProperties properties) {
        return executor(properties.workersFor(SyncQueue.REBUILD), "rebuild-anchor-");
    }

    /** Stream-state applier of the host application takes precedence. */
    @Bean
    @ConditionalOnMissingBean
    public AnchorProofHandler anchorProofHandler() {
        return new LoggingAnchorProofHandler();
    }

    private static Executor executor(int threads, String prefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix(prefix);
        e.initialize();
        return e;
    }
}
