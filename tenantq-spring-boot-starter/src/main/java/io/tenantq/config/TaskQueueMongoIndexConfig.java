package io.tenantq.config;

import io.tenantq.internal.mongo.DeadLetterDocument;
import io.tenantq.internal.mongo.TaskEnvelopeDocument;
import io.tenantq.internal.mongo.TenantDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

/**
 * MongoDB index definitions for the task queue.
 *
 * <p><b>Important:</b> indexes are <b>not</b> created at startup unless
 * {@code tenantq.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <p>{@link #openIdempotencyUniqueIndex()} is required for correctness: without it two producers
 * racing on the same idempotency key can both insert.
 *
 * <h3>Collection {@code task_envelopes}</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { status: 1, queue: 1, notBefore: 1, priority: -1, createdAt: 1 }
 *       <br/>Used by workers claiming the next eligible envelope.</li>
 *   <li><b>ux_open_idempotency</b> (unique + partial): { tenantId: 1, taskType: 1, idempotencyKey: 1 }
 *       with partialFilterExpression { open: true }
 *       <br/>At most one open envelope per key; finished envelopes free the key.</li>
 *   <li><b>idx_lease</b>: { status: 1, lockUntil: 1 }
 *       <br/>Used by the lease reaper.</li>
 * </ul>
 *
 * <h3>Collections {@code dead_letters} and {@code tenants}</h3>
 * <ul>
 *   <li><b>idx_tenant_dead_lettered_at</b>: { tenantId: 1, deadLetteredAt: -1 }</li>
 *   <li><b>idx_slug</b>: { slug: 1 }</li>
 *   <li><b>idx_status_id</b>: { status: 1, _id: 1 } for the scheduler's keyset fan-out.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.task_envelopes.createIndex({ status: 1, queue: 1, notBefore: 1, priority: -1, createdAt: 1 }, { name: "idx_claim" });
 * db.task_envelopes.createIndex(
 *   { tenantId: 1, taskType: 1, idempotencyKey: 1 },
 *   { name: "ux_open_idempotency", unique: true, partialFilterExpression: { open: true } }
 * );
 * db.task_envelopes.createIndex({ status: 1, lockUntil: 1 }, { name: "idx_lease" });
 * db.dead_letters.createIndex({ tenantId: 1, deadLetteredAt: -1 }, { name: "idx_tenant_dead_lettered_at" });
 * db.tenants.createIndex({ slug: 1 }, { name: "idx_slug" });
 * db.tenants.createIndex({ status: 1, _id: 1 }, { name: "idx_status_id" });
 * </pre>
 */
public class TaskQueueMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String UX_OPEN_IDEMPOTENCY = "ux_open_idempotency";
    public static final String IDX_LEASE = "idx_lease";
    public static final String IDX_TENANT_DEAD_LETTERED_AT = "idx_tenant_dead_lettered_at";
    public static final String IDX_SLUG = "idx_slug";
    public static final String IDX_STATUS_ID = "idx_status_id";

    private final MongoTemplate mongoTemplate;

    public TaskQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Creates all indexes above. Idempotent.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(TaskEnvelopeDocument.class).ensureIndex(claimIndex());
        mongoTemplate.indexOps(TaskEnvelopeDocument.class).ensureIndex(openIdempotencyUniqueIndex());
        mongoTemplate.indexOps(TaskEnvelopeDocument.class).ensureIndex(leaseIndex());
        mongoTemplate.indexOps(DeadLetterDocument.class).ensureIndex(deadLetterTenantIndex());
        mongoTemplate.indexOps(TenantDocument.class).ensureIndex(slugIndex());
        mongoTemplate.indexOps(TenantDocument.class).ensureIndex(statusIdIndex());
    }

    public static Index claimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("queue", Sort.Direction.ASC)
                .on("notBefore", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index openIdempotencyUniqueIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("taskType", Sort.Direction.ASC)
                .on("idempotencyKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("open", true)))
                .named(UX_OPEN_IDEMPOTENCY);
    }

    public static Index leaseIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_LEASE);
    }

    public static Index deadLetterTenantIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("deadLetteredAt", Sort.Direction.DESC)
                .named(IDX_TENANT_DEAD_LETTERED_AT);
    }

    public static Index slugIndex() {
        return new Index()
                .on("slug", Sort.Direction.ASC)
                .named(IDX_SLUG);
    }

    public static Index statusIdIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_STATUS_ID);
    }
}
