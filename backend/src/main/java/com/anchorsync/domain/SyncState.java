package com.anchorsync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Singleton document holding durable sync progress. Always stored under {@link #SINGLETON_ID}.
 */
@Document(collection = "anchor_sync_state")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncState {

    public static final String SINGLETON_ID = "anchor-sync";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String processedBlockHash;
    private Long processedBlockNumber;
    private Instant updatedAt;

    public static SyncState empty() {
        return new SyncState(SINGLETON_ID, null, null, Instant.now());
    }

    public SyncProgress toProgress() {
        if (processedBlockHash == null && processedBlockNumber == null) {
            return SyncProgress.unset();
        }
        return new SyncProgress(processedBlockHash, processedBlockNumber);
    }
}
