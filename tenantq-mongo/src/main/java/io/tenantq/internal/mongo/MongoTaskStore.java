package io.tenantq.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskStatus;
import io.tenantq.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for task envelopes.
 *
 * <p>Claims use {@code findAndModify}, so two workers can never both move the same envelope to
 * IN_PROGRESS. Every later write is guarded by the status and lock owner the writer last saw.
 * Idempotent insert relies on the unique partial index
 * {@code (tenantId, taskType, idempotencyKey) where open = true}; see {@code TaskQueueMongoIndexConfig}.
 */
public class MongoTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public EnqueueResult insertIfAbsent(TaskEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");

        for (int attempt = 0; attempt < MAX_INSERT_ATTEMPTS; attempt++) {
            TaskEnvelopeDocument open = findOpen(envelope.tenantId(), envelope.taskType(), envelope.idempotencyKey());
            if (open != null) {
                return EnqueueResult.deduplicated(open.getId());
            }
            try {
                mongoTemplate.insert(TaskEnvelopeDocument.from(envelope));
                return EnqueueResult.createdResult(envelope.id());
            } catch (DuplicateKeyException e) {
                // a concurrent producer inserted the same key between our lookup and insert
                log.debug("tenantq insert raced type={} tenant={} key={} attempt={}",
                        envelope.taskType(), envelope.owner(), envelope.idempotencyKey(), attempt + 1);
            }
        }
        throw new IllegalStateException("Could not store envelope " + envelope.id()
                + " after " + MAX_INSERT_ATTEMPTS + " attempts on key " + envelope.idempotencyKey());
    }

    @Override
    public Optional<TaskEnvelope> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        TaskEnvelopeDocument doc = mongoTemplate.findById(id, TaskEnvelopeDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toEnvelope());
    }

    @Override
    public Optional<TaskEnvelope> claimNext(Collection<String> queues, Instant now, String workerId, Duration lockLifetime) {
        Objects.requireNonNull(queues, "queues must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (queues.isEmpty()) {
            return Optional.empty();
        }

        Query q = new Query(
                Criteria.where("status").in(TaskStatus.PENDING, TaskStatus.RETRYING)
                        .and("queue").in(queues)
                        .and("notBefore").lte(now)
        );
        q.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));

        Update u = new Update()
                .set("status", TaskStatus.IN_PROGRESS)
                .set("lockedBy", workerId)
                .set("lockUntil", now.plus(lockLifetime))
                .set("updatedAt", now);

        TaskEnvelopeDocument doc = mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true),
                TaskEnvelopeDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toEnvelope());
    }

    @Override
    public boolean compareAndSet(TaskEnvelope expected, TaskEnvelope updated) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(updated, "updated must not be null");
        if (!expected.id().equals(updated.id())) {
            throw new IllegalArgumentException("expected and updated must describe the same envelope");
        }

        Query q = new Query(
                Criteria.where("_id").is(expected.id())
                        // stale writers (reaped lease, concurrent cancel) match nothing
                        .and("status").is(expected.status())
                        .and("lockedBy").is(expected.lockedBy())
                        // a reclaim by the same worker id always moves lockUntil forward
                        .and("lockUntil").is(expected.lockUntil())
        );

        Update u = new Update()
                .set("status", updated.status())
                .set("open", !updated.status().isTerminal())
                .set("priority", updated.priority())
                .set("notBefore", updated.notBefore())
                .set("retryCount", updated.retryCount())
                .set("maxRetries", updated.maxRetries())
                .set("lockedBy", updated.lockedBy())
                .set("updatedAt", updated.updatedAt());
        setOrUnset(u, "lastError", updated.lastError());
        setOrUnset(u, "lockUntil", updated.lockUntil());
        if (updated.cancelRequested()) {
            u.set("cancelRequested", true);
        }

        UpdateResult r = mongoTemplate.updateFirst(q, u, TaskEnvelopeDocument.class);
        return r.getMatchedCount() == 1;
    }

    @Override
    public boolean requestCancel(String id, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("open").is(true));
        Update u = new Update()
                .set("cancelRequested", true)
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(q, u, TaskEnvelopeDocument.class).getMatchedCount() == 1;
    }

    @Override
    public List<TaskEnvelope> findExpiredLeases(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(
                Criteria.where("status").is(TaskStatus.IN_PROGRESS)
                        .and("lockUntil").lte(now)
        );
        q.with(Sort.by(Sort.Order.asc("lockUntil")));
        q.limit(limit);
        return mongoTemplate.find(q, TaskEnvelopeDocument.class).stream()
                .map(TaskEnvelopeDocument::toEnvelope)
                .toList();
    }

    private TaskEnvelopeDocument findOpen(String tenantId, String taskType, String idempotencyKey) {
        Query q = new Query(
                Criteria.where("tenantId").is(tenantId)
                        .and("taskType").is(taskType)
                        .and("idempotencyKey").is(idempotencyKey)
                        .and("open").is(true)
        );
        return mongoTemplate.findOne(q, TaskEnvelopeDocument.class);
    }

    private static void setOrUnset(Update u, String field, Object value) {
        if (value != null) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }
}
