package io.tenantq.internal.mongo;

import io.tenantq.spi.TenantDirectory;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatus;
import io.tenantq.tenant.TenantStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tenant directory backed by the {@code tenants} collection.
 *
 * <p>{@link #updateStatus} notifies the registered listeners in the calling thread after the write,
 * which is how a suspension reaches the status cache of this process. Other processes serve
 * enqueue from their cache until its TTL lapses; worker admission always reads this directory.
 */
public class MongoTenantDirectory implements TenantDirectory {
    private static final Logger log = LoggerFactory.getLogger(MongoTenantDirectory.class);

    private final MongoTemplate mongoTemplate;
    private final List<TenantStatusListener> listeners = new CopyOnWriteArrayList<>();

    public MongoTenantDirectory(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void addListener(TenantStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void save(TenantRecord tenant) {
        Objects.requireNonNull(tenant, "tenant must not be null");
        mongoTemplate.save(TenantDocument.from(tenant));
    }

    /**
     * @return false when the tenant does not exist
     */
    public boolean updateStatus(String tenantId, TenantStatus status) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Query q = new Query(Criteria.where("_id").is(tenantId));
        long matched = mongoTemplate.updateFirst(q, new Update().set("status", status), TenantDocument.class).getMatchedCount();
        if (matched == 0) {
            return false;
        }
        log.info("tenant status updated tenantId={} status={}", tenantId, status);
        listeners.forEach(l -> l.onTenantStatusChanged(tenantId, status));
        return true;
    }

    @Override
    public Optional<TenantRecord> findTenant(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        TenantDocument doc = mongoTemplate.findById(tenantId, TenantDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toRecord());
    }

    @Override
    public Optional<TenantRecord> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        TenantDocument doc = mongoTemplate.findOne(new Query(Criteria.where("slug").is(slug)), TenantDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toRecord());
    }

    @Override
    public List<TenantRecord> listActiveTenants(String afterTenantId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Criteria c = Criteria.where("status").is(TenantStatus.ACTIVE);
        if (afterTenantId != null) {
            c = c.and("_id").gt(afterTenantId);
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.asc("_id"))).limit(limit);
        return mongoTemplate.find(q, TenantDocument.class).stream()
                .map(TenantDocument::toRecord)
                .toList();
    }
}
