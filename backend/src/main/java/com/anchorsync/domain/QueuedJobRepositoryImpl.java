package com.anchorsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic updates for sync_jobs.
 */
@Repository
@RequiredArgsConstructor
public class QueuedJobRepositoryImpl implements QueuedJobRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<QueuedJob> claimNext(SyncQueue queue, Instant now) {
        Query query = new Query(where("queue").is(queue)
                .and("state").is(JobState.CREATED)
                .and("startAfter").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "createdOn"));
        Update update = new Update()
                .set("state", JobState.ACTIVE)
                .set("startedOn", now)
                .set("heartbeatAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), QueuedJob.class));
    }

    @Override
    public void updateCurrentBlock(String jobId, long currentBlock, Instant now) {
        Query query = new Query(where("_id").is(jobId).and("state").is(JobState.ACTIVE));
        Update update = new Update()
                .set("data.currentBlock", currentBlock)
                .set("heartbeatAt", now);
        mongoTemplate.updateFirst(query, update, QueuedJob.class);
    }

    @Override
    public boolean updateClaimedCurrentBlock(String jobId, Instant claimedAt, long currentBlock, Instant now) {
        Update update = new Update()
                .set("data.currentBlock", currentBlock)
                .set("heartbeatAt", now);
        return mongoTemplate.updateFirst(claimed(jobId, claimedAt), update, QueuedJob.class).getMatchedCount() > 0;
    }

    @Override
    public boolean touchHeartbeat(String jobId, Instant claimedAt, Instant now) {
        Update update = new Update().set("heartbeatAt", now);
        return mongoTemplate.updateFirst(claimed(jobId, claimedAt), update, QueuedJob.class).getMatchedCount() > 0;
    }

    @Override
    public boolean releaseClaim(QueuedJob job, Instant claimedAt) {
        Update update = new Update()
                .set("state", job.getState())
                .set("attempts", job.getAttempts())
                .set("lastError", job.getLastError())
                .set("startAfter", job.getStartAfter())
                .set("startedOn", job.getStartedOn())
                .set("heartbeatAt", job.getHeartbeatAt())
                .set("completedOn", job.getCompletedOn());
        return mongoTemplate.updateFirst(claimed(job.getId(), claimedAt), update, QueuedJob.class).getMatchedCount() > 0;
    }

    @Override
    public long requeueStaleActive(Instant heartbeatBefore, Instant now) {
        Query query = new Query(where("state").is(JobState.ACTIVE).and("heartbeatAt").lt(heartbeatBefore));
        Update update = new Update()
                .set("state", JobState.CREATED)
                .set("startAfter", now)
                .unset("startedOn")
                .unset("heartbeatAt");
        return mongoTemplate.updateMulti(query, update, QueuedJob.class).getModifiedCount();
    }

    private static Query claimed(String jobId, Instant claimedAt) {
        return new Query(where("_id").is(jobId)
                .and("state").is(JobState.ACTIVE)
                .and("startedOn").is(claimedAt));
    }
}
