package com.anchorsync.sync.state;

import com.anchorsync.domain.SyncProgress;
import com.anchorsync.domain.SyncState;
import com.anchorsync.domain.SyncStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Durable sync progress: the singleton anchor_sync_state document.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncStateStore {

    private final SyncStateRepository syncStateRepository;

    /**
     * Returns the stored progress, creating the singleton with empty fields on first run.
     * An empty document yields {@link SyncProgress#unset()}.
     */
    public SyncProgress load() {
        SyncState state = syncStateRepository.findById(SyncState.SINGLETON_ID).orElseGet(() -> {
            log.info("No sync state found, creating empty {}", SyncState.SINGLETON_ID);
            return syncStateRepository.save(SyncState.empty());
        });
        return state.toProgress();
    }

    public void save(SyncProgress progress) {
        syncStateRepository.save(new SyncState(SyncState.SINGLETON_ID,
                progress.processedBlockHash(), progress.processedBlockNumber(), Instant.now()));
    }
}
