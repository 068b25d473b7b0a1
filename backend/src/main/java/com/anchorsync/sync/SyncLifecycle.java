package com.anchorsync.sync;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.sync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the sync engine once the application is ready and stops it when the context closes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncLifecycle {

    private final SyncApi syncApi;
    private final ChainProvider chainProvider;
    private final SyncProperties syncProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!syncProperties.isEnabled()) {
            log.info("Anchor sync disabled (anchorsync.sync.enabled=false)");
            return;
        }
        syncApi.init(chainProvider);
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (syncApi.isInitialized()) {
            syncApi.shutdown();
        }
    }
}
