package io.tenantq.internal.mongo;

import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.TaskResult;
import io.tenantq.spi.ResultStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for task results and dead letters. Both are keyed by task id, so a repeated
 * save overwrites instead of duplicating.
 */
public class MongoResultStore implements ResultStore {

    private final MongoTemplate mongoTemplate;

    public MongoResultStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void saveResult(TaskResult result) {
        Objects.requireNonNull(result, "result must not be null");
        mongoTemplate.save(TaskResultDocument.from(result));
    }

    @Override
    public Optional<TaskResult> findResult(String taskId) {
        TaskResultDocument doc = mongoTemplate.findById(taskId, TaskResultDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toResult());
    }

    @Override
    public void saveDeadLetter(DeadLetterRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        mongoTemplate.save(DeadLetterDocument.from(record));
    }

    @Override
    public Optional<DeadLetterRecord> findDeadLetter(String taskId) {
        DeadLetterDocument doc = mongoTemplate.findById(taskId, DeadLetterDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toRecord());
    }

    @Override
    public List<DeadLetterRecord> findDeadLetters(String ownerTenantId, int limit) {
        Objects.requireNonNull(ownerTenantId, "ownerTenantId must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("tenantId").is(ownerTenantId));
        q.with(Sort.by(Sort.Order.desc("deadLetteredAt")));
        q.limit(limit);
        return mongoTemplate.find(q, DeadLetterDocument.class).stream()
                .map(DeadLetterDocument::toRecord)
                .toList();
    }
}
