package io.tenantq.core;

import io.tenantq.isolation.TenantOwned;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything needed to inspect or replay a dead-lettered envelope. The original payload is
 * always kept.
 */
public record DeadLetterRecord(
        String taskId,
        String tenantId,
        String taskType,
        String queue,
        byte[] payload,
        int priority,
        int retryCount,
        int maxRetries,
        DeadLetterReason reason,
        String lastError,
        Instant deadLetteredAt
) implements TenantOwned {

    public DeadLetterRecord {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static DeadLetterRecord of(TaskEnvelope envelope, DeadLetterReason reason, String lastError, Instant at) {
        return new DeadLetterRecord(
                envelope.id(),
                envelope.tenantId(),
                envelope.taskType(),
                envelope.queue(),
                envelope.payload(),
                envelope.priority(),
                envelope.retryCount(),
                envelope.maxRetries(),
                reason,
                lastError,
                at
        );
    }
}
