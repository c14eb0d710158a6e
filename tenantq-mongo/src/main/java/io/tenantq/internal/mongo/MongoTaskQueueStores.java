package io.tenantq.internal.mongo;

import io.tenantq.spi.TaskQueueStores;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Mongo-backed persistence ports over one {@link MongoTemplate}.
 */
public final class MongoTaskQueueStores {
    private MongoTaskQueueStores() {
    }

    public static TaskQueueStores create(MongoTemplate mongoTemplate) {
        return create(mongoTemplate, new MongoTenantDirectory(mongoTemplate));
    }

    public static TaskQueueStores create(MongoTemplate mongoTemplate, MongoTenantDirectory tenantDirectory) {
        return new TaskQueueStores(
                new MongoTaskStore(mongoTemplate),
                new MongoResultStore(mongoTemplate),
                new MongoScheduleStore(mongoTemplate),
                tenantDirectory
        );
    }
}
