package com.anchorsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Persistence for sync_jobs. Claiming and cursor updates are atomic and live in {@link QueuedJobRepositoryCustom}.
 */
public interface QueuedJobRepository extends MongoRepository<QueuedJob, String>, QueuedJobRepositoryCustom {

    List<QueuedJob> findByStateAndQueueInOrderByCreatedOnAsc(JobState state, Collection<SyncQueue> queues);

    /** Retention cleanup of terminal jobs. */
    long deleteByStateInAndCompletedOnBefore(Set<JobState> states, Instant cutoff);
}
