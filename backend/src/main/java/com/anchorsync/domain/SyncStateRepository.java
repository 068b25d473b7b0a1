package com.anchorsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for anchor_sync_state. Only the singleton document is ever read or written.
 */
public interface SyncStateRepository extends MongoRepository<SyncState, String> {
}
