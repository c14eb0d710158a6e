package io.tenantq.internal;

import io.tenantq.config.TaskQueueProperties;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskHandlerRegistry;
import io.tenantq.isolation.IsolationEnforcer;
import io.tenantq.isolation.SystemContext;
import io.tenantq.routing.QueueRouter;
import io.tenantq.spi.TaskStore;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatusCache;
import io.tenantq.utils.IdempotencyKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Validates, routes and atomically stores new envelopes.
 *
 * <p>An open envelope with the same {@code (tenantId, taskType, idempotencyKey)} wins: its id is
 * returned and nothing new is stored.
 */
public class TaskEnvelopeFactory {
    private static final Logger log = LoggerFactory.getLogger(TaskEnvelopeFactory.class);

    private final TaskQueueProperties props;
    private final TaskStore taskStore;
    private final TaskHandlerRegistry registry;
    private final TenantStatusCache statusCache;
    private final IsolationEnforcer enforcer;
    private final QueueRouter router;
    private final Clock clock;
    private volatile Runnable onCreated = () -> {
    };

    public TaskEnvelopeFactory(TaskQueueProperties props,
                               TaskStore taskStore,
                               TaskHandlerRegistry registry,
                               TenantStatusCache statusCache,
                               IsolationEnforcer enforcer,
                               QueueRouter router,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache must not be null");
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @throws io.tenantq.tenant.AuthenticationException when the tenant is unknown or not ACTIVE
     * @throws IllegalArgumentException                   for an unregistered task type or invalid arguments
     */
    public EnqueueResult enqueue(String tenantId,
                                 String taskType,
                                 byte[] payload,
                                 int priority,
                                 Integer maxRetries,
                                 String idempotencyKey,
                                 Instant notBefore) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        requireRegistered(taskType);
        Objects.requireNonNull(payload, "payload must not be null");

        TenantRecord tenant = statusCache.requireActive(tenantId);
        String queue = router.route(taskType, tenant.tier());
        String key = resolveKey(tenantId, taskType, payload, idempotencyKey);

        Instant now = clock.instant();
        TaskEnvelope envelope = TaskEnvelope.pending(newId(), tenantId, false, taskType, queue, key, payload,
                priority, resolveMaxRetries(maxRetries), notBefore, now);
        return store(envelope);
    }

    /**
     * Stores an envelope owned by no tenant. It routes as an any-tier task.
     */
    public EnqueueResult enqueueSystem(SystemContext system,
                                       String taskType,
                                       byte[] payload,
                                       int priority,
                                       String idempotencyKey) {
        Objects.requireNonNull(system, "system must not be null");
        requireRegistered(taskType);
        Objects.requireNonNull(payload, "payload must not be null");

        String queue = router.route(taskType, null);
        String key = resolveKey(null, taskType, payload, idempotencyKey);
        Instant now = clock.instant();
        TaskEnvelope envelope = TaskEnvelope.pending(newId(), null, true, taskType, queue, key, payload,
                priority, resolveMaxRetries(null), null, now);
        try {
            return enforcer.runAsSystem(system, () -> store(envelope));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("System enqueue failed for " + taskType, e);
        }
    }

    private EnqueueResult store(TaskEnvelope envelope) {
        EnqueueResult result = taskStore.insertIfAbsent(envelope);
        if (result.created()) {
            onCreated.run();
            log.debug("tenantq task enqueued type={} id={} tenant={} queue={} priority={}",
                    envelope.taskType(), result.taskId(), envelope.owner(), envelope.queue(), envelope.priority());
        } else {
            log.debug("tenantq task deduplicated type={} id={} tenant={} key={}",
                    envelope.taskType(), result.taskId(), envelope.owner(), envelope.idempotencyKey());
        }
        return result;
    }

    void onCreated(Runnable callback) {
        this.onCreated = Objects.requireNonNull(callback, "callback must not be null");
    }

    private void requireRegistered(String taskType) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType must not be blank");
        }
        if (!registry.contains(taskType)) {
            throw new IllegalArgumentException("Unknown task type: " + taskType + " (registered: " + Set.copyOf(registry.taskTypes()) + ")");
        }
    }

    private int resolveMaxRetries(Integer maxRetries) {
        int value = maxRetries != null ? maxRetries : props.getDefaultMaxRetries();
        if (value < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        return value;
    }

    private static String resolveKey(String tenantId, String taskType, byte[] payload, String idempotencyKey) {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return idempotencyKey;
        }
        return IdempotencyKeys.derive(tenantId, taskType, payload);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
