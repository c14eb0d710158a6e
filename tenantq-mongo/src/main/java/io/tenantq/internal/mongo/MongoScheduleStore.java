package io.tenantq.internal.mongo;

import io.tenantq.schedule.ScheduleEntry;
import io.tenantq.spi.ScheduleStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduleEntry> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("_id")));
        return mongoTemplate.find(q, ScheduleEntryDocument.class).stream()
                .map(ScheduleEntryDocument::toEntry)
                .toList();
    }

    @Override
    public Optional<ScheduleEntry> findById(String id) {
        ScheduleEntryDocument doc = mongoTemplate.findById(id, ScheduleEntryDocument.class);
        return doc == null ? Optional.empty() : Optional.of(doc.toEntry());
    }

    @Override
    public void save(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        mongoTemplate.save(ScheduleEntryDocument.from(entry));
    }

    @Override
    public boolean advanceWatermark(String entryId, Instant expected, Instant next) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        Objects.requireNonNull(next, "next must not be null");
        if (expected != null && next.isBefore(expected)) {
            return false;
        }

        Query q = new Query(Criteria.where("_id").is(entryId).and("lastFiredWatermark").is(expected));
        Update u = new Update().set("lastFiredWatermark", next);
        if (mongoTemplate.updateFirst(q, u, ScheduleEntryDocument.class).getMatchedCount() == 1) {
            return true;
        }
        // another scheduler instance may have stored the same fire time already
        return findById(entryId)
                .map(ScheduleEntry::lastFiredWatermark)
                .map(next::equals)
                .orElse(false);
    }
}
