package io.tenantq;

import io.tenantq.retry.TaskCancelledException;
import io.tenantq.tenant.TenantContext;

import java.time.Instant;

/**
 * Per-attempt view handed to a {@link TaskHandler}.
 */
public interface TaskExecution {

    /**
     * Tenant of the envelope. Null only for system-scoped envelopes.
     */
    TenantContext tenant();

    String taskId();

    /**
     * 1 for the first attempt.
     */
    int attempt();

    Instant deadline();

    /**
     * True once a cancel request was recorded for the running envelope.
     */
    boolean isCancellationRequested();

    /**
     * Throws {@link TaskCancelledException} when cancellation was requested.
     */
    default void checkCancellation() throws TaskCancelledException {
        if (isCancellationRequested()) {
            throw new TaskCancelledException(taskId());
        }
    }
}
