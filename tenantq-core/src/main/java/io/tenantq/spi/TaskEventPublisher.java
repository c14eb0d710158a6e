package io.tenantq.spi;

import io.tenantq.core.TaskEvent;

/**
 * Outbound port for lifecycle events, consumed by the realtime notification layer.
 */
@FunctionalInterface
public interface TaskEventPublisher {

    void publish(TaskEvent event);

    static TaskEventPublisher noop() {
        return event -> {
        };
    }
}
