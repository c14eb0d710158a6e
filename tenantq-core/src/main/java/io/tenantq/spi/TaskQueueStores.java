package io.tenantq.spi;

import java.util.Objects;

/**
 * The persistence ports a task queue runs on.
 */
public record TaskQueueStores(
        TaskStore taskStore,
        ResultStore resultStore,
        ScheduleStore scheduleStore,
        TenantDirectory tenantDirectory
) {
    public TaskQueueStores {
        Objects.requireNonNull(taskStore, "taskStore must not be null");
        Objects.requireNonNull(resultStore, "resultStore must not be null");
        Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        Objects.requireNonNull(tenantDirectory, "tenantDirectory must not be null");
    }
}
