package io.tenantq.internal;

import io.tenantq.TaskExecution;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.spi.TaskStore;
import io.tenantq.tenant.TenantContext;

import java.time.Instant;

/**
 * Attempt view backed by the task store; the cancel flag is read from the stored envelope.
 */
class DefaultTaskExecution implements TaskExecution {

    private final TenantContext tenant;
    private final TaskEnvelope envelope;
    private final Instant deadline;
    private final TaskStore taskStore;

    DefaultTaskExecution(TenantContext tenant, TaskEnvelope envelope, Instant deadline, TaskStore taskStore) {
        this.tenant = tenant;
        this.envelope = envelope;
        this.deadline = deadline;
        this.taskStore = taskStore;
    }

    @Override
    public TenantContext tenant() {
        return tenant;
    }

    @Override
    public String taskId() {
        return envelope.id();
    }

    @Override
    public int attempt() {
        return envelope.retryCount() + 1;
    }

    @Override
    public Instant deadline() {
        return deadline;
    }

    @Override
    public boolean isCancellationRequested() {
        return Thread.currentThread().isInterrupted()
                || taskStore.findById(envelope.id()).map(TaskEnvelope::cancelRequested).orElse(true);
    }
}
