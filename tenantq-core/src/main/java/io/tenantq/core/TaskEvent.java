package io.tenantq.core;

import io.tenantq.isolation.TenantOwned;

import java.time.Instant;

/**
 * Lifecycle event emitted after a state transition has been stored.
 *
 * <p>{@link TaskEventType#FAILED} is emitted for every failed attempt (the envelope is then
 * RETRYING) and for cancellation (the envelope is then FAILED); {@link #status()} tells them apart.
 */
public record TaskEvent(
        TaskEventType type,
        String taskId,
        String tenantId,
        String taskType,
        TaskStatus status,
        int retryCount,
        String detail,
        Instant occurredAt
) implements TenantOwned {

    public static TaskEvent of(TaskEventType type, TaskEnvelope envelope, String detail, Instant at) {
        return new TaskEvent(type, envelope.id(), envelope.tenantId(), envelope.taskType(),
                envelope.status(), envelope.retryCount(), detail, at);
    }
}
