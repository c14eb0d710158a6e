package io.tenantq.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tenantq.TaskHandler;
import io.tenantq.config.TaskQueueProperties;
import io.tenantq.core.DeadLetterReason;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskEvent;
import io.tenantq.core.TaskEventType;
import io.tenantq.core.TaskHandlerRegistry;
import io.tenantq.core.TaskResult;
import io.tenantq.isolation.IsolationEnforcer;
import io.tenantq.isolation.SystemContext;
import io.tenantq.isolation.TenantScope;
import io.tenantq.retry.RetryDeadLetterManager;
import io.tenantq.spi.ResultStore;
import io.tenantq.spi.TaskEventPublisher;
import io.tenantq.spi.TaskStore;
import io.tenantq.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads that claim envelopes from the store and run their handlers.
 *
 * <p>Each worker claims one envelope at a time. The handler runs on a separate executor so the
 * worker can enforce the time limit; the tenant context is bound around the call and removed
 * afterwards. A reaper turns expired leases of crashed workers into transient failures.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final String MDC_TENANT = "tenantId";
    static final String MDC_TASK = "taskId";
    static final String LEASE_EXPIRED = "lease expired";
    private static final int REAP_BATCH = 100;

    private final TaskQueueProperties props;
    private final TaskStore taskStore;
    private final ResultStore resultStore;
    private final TaskHandlerRegistry registry;
    private final IsolationEnforcer enforcer;
    private final RetryDeadLetterManager retryManager;
    private final ObjectMapper objectMapper;
    private final TaskEventPublisher eventPublisher;
    private final Clock clock;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore refillSignal = new Semaphore(0);
    private final List<Thread> workers = new ArrayList<>();
    private volatile ExecutorService handlerExecutor;
    private Thread reaperThread;

    public WorkerPool(TaskQueueProperties props,
                      TaskStore taskStore,
                      ResultStore resultStore,
                      TaskHandlerRegistry registry,
                      IsolationEnforcer enforcer,
                      RetryDeadLetterManager retryManager,
                      ObjectMapper objectMapper,
                      TaskEventPublisher eventPublisher,
                      Clock clock,
                      String workerId) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.resultStore = Objects.requireNonNull(resultStore, "resultStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer must not be null");
        this.retryManager = Objects.requireNonNull(retryManager, "retryManager must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        requireTimeoutsWithinLease();
    }

    /**
     * An attempt that may outlive its lease can be reaped and re-claimed while it still runs.
     */
    private void requireTimeoutsWithinLease() {
        Duration lockLifetime = props.getLockLifetime();
        if (lockLifetime == null || lockLifetime.isZero() || lockLifetime.isNegative()) {
            return;
        }
        Duration defaultTimeout = props.getDefaultTimeout();
        if (defaultTimeout != null && defaultTimeout.compareTo(lockLifetime) >= 0) {
            throw new IllegalArgumentException("tenantq.defaultTimeout (" + defaultTimeout
                    + ") must be shorter than tenantq.lockLifetime (" + lockLifetime + ")");
        }
        for (String taskType : registry.taskTypes()) {
            Duration timeout = registry.find(taskType).map(TaskHandler::timeout).orElse(null);
            if (timeout != null && timeout.compareTo(lockLifetime) >= 0) {
                throw new IllegalStateException("Handler timeout for taskType=" + taskType + " (" + timeout
                        + ") must be shorter than tenantq.lockLifetime (" + lockLifetime + ")");
            }
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        int concurrency = props.getWorkerConcurrency();
        if (concurrency <= 0) {
            throw new IllegalArgumentException("tenantq.workerConcurrency must be positive");
        }
        requirePositive(props.getPollInterval(), "tenantq.pollInterval");
        requirePositive(props.getLockLifetime(), "tenantq.lockLifetime");

        log.info("tenantq worker pool starting workerId={} concurrency={} queues={} pollInterval={} lockLifetime={}",
                workerId, concurrency, props.getQueues(), props.getPollInterval(), props.getLockLifetime());

        AtomicInteger handlerThreads = new AtomicInteger();
        handlerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tenantq.handler-" + handlerThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (int i = 0; i < concurrency; i++) {
            Thread t = new Thread(this::workerLoop);
            t.setName("tenantq.worker-" + i);
            t.setDaemon(true);
            workers.add(t);
            t.start();
        }

        reaperThread = new Thread(this::reaperLoop);
        reaperThread.setName("tenantq.reaper");
        reaperThread.setDaemon(true);
        reaperThread.start();
    }

    /**
     * Stops claiming; running attempts get {@code shutdownTimeout} to finish before they are interrupted.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            shutdownHandlerExecutor();
            return;
        }
        log.info("tenantq worker pool stopping workerId={}", workerId);

        refillSignal.release(workers.size());
        if (reaperThread != null) {
            reaperThread.interrupt();
            reaperThread = null;
        }

        long deadline = System.nanoTime() + props.getShutdownTimeout().toNanos();
        for (Thread t : workers) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                t.join(Math.max(1, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.forEach(Thread::interrupt);
        workers.clear();

        shutdownHandlerExecutor();
        refillSignal.drainPermits();
        log.info("tenantq worker pool stopped workerId={}", workerId);
    }

    /**
     * Wakes idle workers, called after an envelope was stored.
     */
    public void signal() {
        if (started.get()) {
            refillSignal.release();
        }
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claims and processes at most one envelope on the calling thread.
     *
     * @return true when an envelope was claimed
     */
    public boolean runOnce() {
        Instant now = clock.instant();
        Optional<TaskEnvelope> claimed = taskStore.claimNext(props.getQueues(), now, workerId, props.getLockLifetime());
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    /**
     * Fails expired leases as transient errors.
     *
     * @return number of envelopes this call moved
     */
    public int reapExpiredLeases() {
        int moved = 0;
        for (TaskEnvelope expired : taskStore.findExpiredLeases(clock.instant(), REAP_BATCH)) {
            log.warn("tenantq lease expired type={} id={} tenant={} lockedBy={} lockUntil={}",
                    expired.taskType(), expired.id(), expired.owner(), expired.lockedBy(), expired.lockUntil());
            if (retryManager.handleTransient(expired, LEASE_EXPIRED).isPresent()) {
                moved++;
            }
        }
        return moved;
    }

    void process(TaskEnvelope envelope) {
        if (envelope.cancelRequested()) {
            retryManager.cancelled(envelope);
            return;
        }
        Optional<TaskHandler<?>> handler = registry.find(envelope.taskType());
        if (handler.isEmpty()) {
            // stored by another deployment with a different handler set
            retryManager.deadLetter(envelope, DeadLetterReason.PERMANENT_FAILURE,
                    "No TaskHandler registered for task type: " + envelope.taskType());
            return;
        }
        TaskHandler<?> h = handler.get();

        putMdc(envelope);
        try {
            log.debug("tenantq task started type={} id={} tenant={} attempt={}",
                    envelope.taskType(), envelope.id(), envelope.owner(), envelope.retryCount() + 1);
            Object result = invoke(envelope, h);
            complete(envelope, result);
        } catch (Exception e) {
            log.debug("tenantq task attempt failed type={} id={} msg={}", envelope.taskType(), envelope.id(), e.getMessage(), e);
            retryManager.classifyAndHandle(envelope, e, h::classify);
        } finally {
            clearMdc();
        }
    }

    private Object invoke(TaskEnvelope envelope, TaskHandler<?> handler) throws Exception {
        // admission happens on every attempt, so a suspension between retries blocks the handler
        TenantContext tenant = envelope.systemScoped() ? null : enforcer.admitTenant(envelope.tenantId());

        Duration timeout = handler.timeout() != null ? handler.timeout() : props.getDefaultTimeout();
        Instant deadline = clock.instant().plus(timeout);
        Object payload = deserialize(envelope, handler.payloadClass());
        DefaultTaskExecution execution = new DefaultTaskExecution(tenant, envelope, deadline, taskStore);

        Callable<Object> call = () -> {
            putMdc(envelope);
            try {
                if (tenant == null) {
                    SystemContext system = SystemContext.of("worker:" + workerId, "system task " + envelope.taskType());
                    return enforcer.runAsSystem(system, () -> execute(handler, payload, execution));
                }
                return TenantScope.callWith(tenant, () -> execute(handler, payload, execution));
            } finally {
                clearMdc();
            }
        };

        Future<Object> future = executor().submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("handler " + envelope.taskType() + " timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private void complete(TaskEnvelope claimed, Object result) {
        byte[] resultBytes;
        try {
            resultBytes = result == null ? null : objectMapper.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            retryManager.deadLetter(claimed, DeadLetterReason.PERMANENT_FAILURE, "result not serializable: " + e.getOriginalMessage());
            return;
        }

        Instant now = clock.instant();
        TaskEnvelope done = claimed.completed(now);
        if (!taskStore.compareAndSet(claimed, done)) {
            log.warn("tenantq task finished after losing its lease type={} id={} tenant={}",
                    claimed.taskType(), claimed.id(), claimed.owner());
            return;
        }
        resultStore.saveResult(TaskResult.success(done, resultBytes, now));
        eventPublisher.publish(TaskEvent.of(TaskEventType.COMPLETED, done, null, now));
        log.debug("tenantq task succeeded type={} id={} tenant={}", claimed.taskType(), claimed.id(), claimed.owner());
    }

    private Object deserialize(TaskEnvelope envelope, Class<?> payloadClass) throws Exception {
        if (payloadClass == byte[].class) {
            return envelope.payload();
        }
        if (envelope.payload().length == 0) {
            return null;
        }
        return objectMapper.readValue(envelope.payload(), payloadClass);
    }

    @SuppressWarnings("unchecked")
    private static <T> Object execute(TaskHandler<T> handler, Object payload, DefaultTaskExecution execution) throws Exception {
        return handler.execute((T) payload, execution);
    }

    private ExecutorService executor() {
        ExecutorService e = handlerExecutor;
        if (e == null) {
            synchronized (this) {
                if (handlerExecutor == null) {
                    // runOnce() without start(), e.g. in embedded use
                    handlerExecutor = Executors.newCachedThreadPool(r -> {
                        Thread t = new Thread(r);
                        t.setName("tenantq.handler");
                        t.setDaemon(true);
                        return t;
                    });
                }
                e = handlerExecutor;
            }
        }
        return e;
    }

    private synchronized void shutdownHandlerExecutor() {
        if (handlerExecutor != null) {
            handlerExecutor.shutdownNow();
            handlerExecutor = null;
        }
    }

    private void workerLoop() {
        int systemErrorCount = 0;
        while (started.get()) {
            boolean worked;
            try {
                worked = runOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("tenantq worker poll failed workerId={} msg={}", workerId, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (worked || !started.get()) {
                continue;
            }
            try {
                refillSignal.tryAcquire(props.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void reaperLoop() {
        while (started.get()) {
            try {
                reapExpiredLeases();
            } catch (Exception e) {
                log.error("tenantq lease reaper failed msg={}", e.getMessage(), e);
            }
            try {
                Thread.sleep(props.getLeaseReapInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static void putMdc(TaskEnvelope envelope) {
        MDC.put(MDC_TENANT, envelope.owner());
        MDC.put(MDC_TASK, envelope.id());
    }

    private static void clearMdc() {
        MDC.remove(MDC_TENANT);
        MDC.remove(MDC_TASK);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
