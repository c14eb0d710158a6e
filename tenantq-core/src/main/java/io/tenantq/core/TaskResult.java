package io.tenantq.core;

import io.tenantq.isolation.TenantOwned;

import java.time.Instant;

/**
 * Outcome of an envelope as seen by producers.
 *
 * <p>For envelopes still in flight {@code completedAt} is null and neither payload nor error is set.
 */
public record TaskResult(
        String taskId,
        String tenantId,
        TaskStatus status,
        byte[] resultPayload,
        String errorDetail,
        Instant completedAt
) implements TenantOwned {

    public static TaskResult success(TaskEnvelope envelope, byte[] resultPayload, Instant completedAt) {
        return new TaskResult(envelope.id(), envelope.tenantId(), TaskStatus.COMPLETED, resultPayload, null, completedAt);
    }

    public static TaskResult failure(TaskEnvelope envelope, TaskStatus status, String errorDetail, Instant completedAt) {
        return new TaskResult(envelope.id(), envelope.tenantId(), status, null, errorDetail, completedAt);
    }

    public static TaskResult inFlight(TaskEnvelope envelope) {
        return new TaskResult(envelope.id(), envelope.tenantId(), envelope.status(), null, envelope.lastError(), null);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }
}
