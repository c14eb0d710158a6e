package io.tenantq;

import io.tenantq.core.CancelResult;
import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.StatusQueryResult;
import io.tenantq.isolation.SystemContext;
import io.tenantq.tenant.TenantContext;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for producers and operators of the tenant-isolated task queue.
 *
 * <p>All tenant-scoped calls check ownership: a task of another tenant is reported as
 * {@code FORBIDDEN}, never returned.
 */
public interface TaskQueue {
    void start();

    void stop();

    /**
     * Fluent enqueue with a Jackson-serialized payload object.
     */
    <T> TaskBuilder<T> create(String tenantId, String taskType, T payload);

    /**
     * Enqueue with raw payload bytes.
     *
     * @param maxRetries     null means the configured default
     * @param idempotencyKey null means a key derived from tenant, task type and payload
     * @param notBefore      null means now
     */
    EnqueueResult enqueue(String tenantId,
                          String taskType,
                          byte[] payload,
                          int priority,
                          Integer maxRetries,
                          String idempotencyKey,
                          Instant notBefore);

    /**
     * Enqueue an envelope that belongs to no tenant, for platform maintenance. The call is audited.
     */
    EnqueueResult enqueueSystemTask(SystemContext system,
                                    String taskType,
                                    byte[] payload,
                                    int priority,
                                    String idempotencyKey);

    StatusQueryResult getStatus(String taskId, String tenantId);

    StatusQueryResult getStatus(String taskId, TenantContext context);

    /**
     * Advisory cancel: unclaimed envelopes fail at once, running ones get their cancel flag set.
     */
    CancelResult cancel(String taskId, String tenantId);

    CancelResult cancel(String taskId, TenantContext context);

    List<DeadLetterRecord> deadLetters(TenantContext context, int limit);

    /**
     * Re-enqueues the original payload of a dead-lettered envelope as a new envelope.
     */
    EnqueueResult replayDeadLetter(String taskId, TenantContext context);
}
