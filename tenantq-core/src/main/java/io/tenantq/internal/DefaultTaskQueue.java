package io.tenantq.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tenantq.TaskBuilder;
import io.tenantq.TaskQueue;
import io.tenantq.config.TaskQueueProperties;
import io.tenantq.core.CancelResult;
import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.StatusQueryResult;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskHandlerRegistry;
import io.tenantq.core.TaskResult;
import io.tenantq.isolation.IsolationEnforcer;
import io.tenantq.isolation.SystemContext;
import io.tenantq.retry.ExponentialBackoffRetryPolicy;
import io.tenantq.retry.RetryDeadLetterManager;
import io.tenantq.routing.QueueRouter;
import io.tenantq.schedule.Scheduler;
import io.tenantq.schedule.SchedulerListener;
import io.tenantq.spi.TaskEventPublisher;
import io.tenantq.spi.TaskQueueStores;
import io.tenantq.tenant.TenantContext;
import io.tenantq.tenant.TenantStatusCache;
import io.tenantq.tenant.TenantTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Store-agnostic {@link TaskQueue}: wires the envelope factory, worker pool, retry manager and
 * scheduler over the given persistence ports.
 *
 * <p>Typical usage:
 * <pre>{@code
 * taskQueue.start();
 *
 * EnqueueResult r = taskQueue.create(tenantId, "send_email", new EmailPayload("a@b.c"))
 *       .priority(Priority.HIGH)
 *       .submit();
 *
 * taskQueue.getStatus(r.taskId(), tenantId);
 * taskQueue.stop();
 * }</pre>
 */
public class DefaultTaskQueue implements TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskQueue.class);

    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final TaskQueueProperties props;
    private final TaskQueueStores stores;
    private final TenantStatusCache statusCache;
    private final IsolationEnforcer enforcer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final QueueRouter router;
    private final TaskEnvelopeFactory factory;
    private final RetryDeadLetterManager retryManager;
    private final WorkerPool workerPool;
    private final Scheduler scheduler;

    public DefaultTaskQueue(TaskQueueProperties props,
                            TaskQueueStores stores,
                            TaskHandlerRegistry registry,
                            TenantStatusCache statusCache,
                            IsolationEnforcer enforcer,
                            ObjectMapper objectMapper,
                            TaskEventPublisher eventPublisher,
                            SchedulerListener schedulerListener,
                            Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache must not be null");
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        TaskEventPublisher publisher = eventPublisher != null ? eventPublisher : TaskEventPublisher.noop();

        this.router = QueueRouter.fromProperties(props);
        warnOnUnconsumedQueues(registry);

        this.factory = new TaskEnvelopeFactory(props, stores.taskStore(), registry, statusCache, enforcer, router, clock);
        this.retryManager = new RetryDeadLetterManager(stores.taskStore(), stores.resultStore(), publisher,
                ExponentialBackoffRetryPolicy.fromProperties(props), clock);
        this.workerPool = new WorkerPool(props, stores.taskStore(), stores.resultStore(), registry, enforcer,
                retryManager, objectMapper, publisher, clock, WorkerIds.resolve(props.getWorkerId()));
        this.scheduler = new Scheduler(props, stores.scheduleStore(), stores.tenantDirectory(), factory,
                schedulerListener, clock);
        this.factory.onCreated(workerPool::signal);
    }

    @Override
    public void start() {
        workerPool.start();
        if (props.isSchedulerEnabled()) {
            scheduler.start();
        }
        log.info("tenantq task queue started workerId={} bindingsVersion={}", workerPool.workerId(), router.version());
    }

    @Override
    public void stop() {
        scheduler.stop();
        workerPool.stop();
    }

    @Override
    public <T> TaskBuilder<T> create(String tenantId, String taskType, T payload) {
        return new SimpleTaskBuilder<>(tenantId, taskType, payload, props.getDefaultPriority(), objectMapper, factory);
    }

    @Override
    public EnqueueResult enqueue(String tenantId,
                                 String taskType,
                                 byte[] payload,
                                 int priority,
                                 Integer maxRetries,
                                 String idempotencyKey,
                                 Instant notBefore) {
        return factory.enqueue(tenantId, taskType, payload, priority, maxRetries, idempotencyKey, notBefore);
    }

    @Override
    public EnqueueResult enqueueSystemTask(SystemContext system, String taskType, byte[] payload, int priority, String idempotencyKey) {
        return factory.enqueueSystem(system, taskType, payload, priority, idempotencyKey);
    }

    @Override
    public StatusQueryResult getStatus(String taskId, String tenantId) {
        return getStatus(taskId, contextOf(tenantId));
    }

    @Override
    public StatusQueryResult getStatus(String taskId, TenantContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Optional<TaskEnvelope> found = stores.taskStore().findById(taskId);
        if (found.isEmpty()) {
            return StatusQueryResult.notFound();
        }
        TaskEnvelope envelope = found.get();
        if (!enforcer.owns(context, envelope)) {
            log.warn("tenantq status denied id={} tenant={} owner={}", taskId, context.tenantId(), envelope.owner());
            return StatusQueryResult.forbidden();
        }
        if (!envelope.status().isTerminal()) {
            return StatusQueryResult.found(TaskResult.inFlight(envelope));
        }
        List<TaskResult> stored = enforcer.query(owner -> stores.resultStore().findResult(taskId)
                .filter(r -> owner.equals(r.tenantId()))
                .stream()
                .toList(), context);
        return StatusQueryResult.found(stored.isEmpty() ? TaskResult.inFlight(envelope) : stored.get(0));
    }

    @Override
    public CancelResult cancel(String taskId, String tenantId) {
        return cancel(taskId, contextOf(tenantId));
    }

    @Override
    public CancelResult cancel(String taskId, TenantContext context) {
        Objects.requireNonNull(context, "context must not be null");
        for (int attempt = 0; attempt < MAX_CANCEL_ATTEMPTS; attempt++) {
            Optional<TaskEnvelope> found = stores.taskStore().findById(taskId);
            if (found.isEmpty()) {
                return CancelResult.notFound();
            }
            TaskEnvelope envelope = found.get();
            if (!enforcer.owns(context, envelope)) {
                log.warn("tenantq cancel denied id={} tenant={} owner={}", taskId, context.tenantId(), envelope.owner());
                return CancelResult.forbidden();
            }
            if (envelope.status().isTerminal()) {
                return CancelResult.acknowledged(CancelResult.Effect.NONE);
            }
            if (envelope.status().isClaimable()) {
                if (retryManager.cancelled(envelope).isPresent()) {
                    return CancelResult.acknowledged(CancelResult.Effect.CANCELLED);
                }
                continue;
            }
            if (stores.taskStore().requestCancel(taskId, clock.instant())) {
                log.info("tenantq cancel requested type={} id={} tenant={}", envelope.taskType(), taskId, envelope.owner());
                return CancelResult.acknowledged(CancelResult.Effect.CANCELLATION_REQUESTED);
            }
        }
        return CancelResult.acknowledged(CancelResult.Effect.NONE);
    }

    @Override
    public List<DeadLetterRecord> deadLetters(TenantContext context, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return enforcer.query(owner -> stores.resultStore().findDeadLetters(owner, limit), context);
    }

    @Override
    public EnqueueResult replayDeadLetter(String taskId, TenantContext context) {
        Objects.requireNonNull(context, "context must not be null");
        DeadLetterRecord record = stores.resultStore().findDeadLetter(taskId)
                .orElseThrow(() -> new IllegalArgumentException("No dead letter for task " + taskId));
        enforcer.checkOwnership(record, context);

        EnqueueResult result = factory.enqueue(context.tenantId(), record.taskType(), record.payload(), record.priority(),
                record.maxRetries(), "replay:" + taskId, null);
        log.info("tenantq dead letter replayed type={} id={} tenant={} newId={}",
                record.taskType(), taskId, context.tenantId(), result.taskId());
        return result;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public QueueRouter router() {
        return router;
    }

    private TenantContext contextOf(String tenantId) {
        return TenantContext.from(statusCache.requireActive(tenantId));
    }

    private void warnOnUnconsumedQueues(TaskHandlerRegistry registry) {
        for (String taskType : registry.taskTypes()) {
            for (TenantTier tier : TenantTier.values()) {
                String queue = router.route(taskType, tier);
                if (!props.getQueues().contains(queue)) {
                    log.warn("tenantq task type routed to a queue no worker consumes type={} tier={} queue={} consumed={}",
                            taskType, tier, queue, props.getQueues());
                }
            }
        }
    }
}
