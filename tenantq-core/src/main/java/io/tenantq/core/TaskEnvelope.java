package io.tenantq.core;

import io.tenantq.isolation.TenantOwned;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable unit of asynchronous work.
 *
 * <p>Immutable: every state change goes through one of the transition methods below, which
 * reject moves the {@link TaskStatus} state machine does not allow. The payload array is shared,
 * callers must not mutate it.
 */
public record TaskEnvelope(

        // identity
        String id,
        String tenantId,
        boolean systemScoped,
        String taskType,
        String queue,
        String idempotencyKey,

        // payload
        byte[] payload,

        // scheduling
        int priority,
        Instant notBefore,

        // retry bookkeeping
        int retryCount,
        int maxRetries,
        String lastError,

        // state and claim lease
        TaskStatus status,
        String lockedBy,
        Instant lockUntil,
        boolean cancelRequested,

        Instant createdAt,
        Instant updatedAt
) implements TenantOwned {

    public TaskEnvelope {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (tenantId == null && !systemScoped) {
            throw new IllegalArgumentException("tenantId must not be null for a tenant-scoped envelope");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException("retryCount must be within [0, maxRetries]: " + retryCount);
        }
    }

    public static TaskEnvelope pending(String id,
                                       String tenantId,
                                       boolean systemScoped,
                                       String taskType,
                                       String queue,
                                       String idempotencyKey,
                                       byte[] payload,
                                       int priority,
                                       int maxRetries,
                                       Instant notBefore,
                                       Instant now) {
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore != null ? notBefore : now, 0, maxRetries, null,
                TaskStatus.PENDING, null, null, false, now, now);
    }

    public boolean retriesExhausted() {
        return retryCount >= maxRetries;
    }

    /**
     * Human readable owner for logs: the tenant id or "system".
     */
    public String owner() {
        return systemScoped && tenantId == null ? "system" : tenantId;
    }

    public TaskEnvelope claimed(String workerId, Instant lockUntil, Instant now) {
        requireTransition(TaskStatus.IN_PROGRESS);
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore, retryCount, maxRetries, lastError,
                TaskStatus.IN_PROGRESS, workerId, lockUntil, cancelRequested, createdAt, now);
    }

    public TaskEnvelope completed(Instant now) {
        requireTransition(TaskStatus.COMPLETED);
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore, retryCount, maxRetries, lastError,
                TaskStatus.COMPLETED, null, null, cancelRequested, createdAt, now);
    }

    public TaskEnvelope retrying(int nextRetryCount, Instant nextNotBefore, String error, Instant now) {
        requireTransition(TaskStatus.RETRYING);
        requireMonotonic(nextRetryCount);
        if (nextRetryCount >= maxRetries) {
            throw new IllegalStateException("retryCount " + nextRetryCount + " reached maxRetries "
                    + maxRetries + "; only DEAD_LETTERED is allowed for envelope " + id);
        }
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, nextNotBefore, nextRetryCount, maxRetries, error,
                TaskStatus.RETRYING, null, null, cancelRequested, createdAt, now);
    }

    public TaskEnvelope deadLettered(int finalRetryCount, String error, Instant now) {
        requireTransition(TaskStatus.DEAD_LETTERED);
        requireMonotonic(finalRetryCount);
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore, finalRetryCount, maxRetries, error,
                TaskStatus.DEAD_LETTERED, null, null, cancelRequested, createdAt, now);
    }

    public TaskEnvelope failed(String error, Instant now) {
        requireTransition(TaskStatus.FAILED);
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore, retryCount, maxRetries, error,
                TaskStatus.FAILED, null, null, cancelRequested, createdAt, now);
    }

    public TaskEnvelope withCancelRequested(Instant now) {
        return new TaskEnvelope(id, tenantId, systemScoped, taskType, queue, idempotencyKey, payload,
                priority, notBefore, retryCount, maxRetries, lastError,
                status, lockedBy, lockUntil, true, createdAt, now);
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + next + " for envelope " + id);
        }
    }

    private void requireMonotonic(int nextRetryCount) {
        if (nextRetryCount < retryCount) {
            throw new IllegalStateException("retryCount must not decrease for envelope " + id);
        }
        if (nextRetryCount > maxRetries) {
            throw new IllegalStateException("retryCount must not exceed maxRetries for envelope " + id);
        }
    }
}
