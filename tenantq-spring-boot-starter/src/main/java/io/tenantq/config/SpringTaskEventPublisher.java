package io.tenantq.config;

import io.tenantq.core.TaskEvent;
import io.tenantq.spi.TaskEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Republishes task lifecycle events as Spring application events so the notification layer can
 * consume them with {@code @EventListener(TaskEvent.class)}.
 *
 * <p>A failing listener never changes the stored task state; the failure is logged and dropped.
 */
public class SpringTaskEventPublisher implements TaskEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(SpringTaskEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringTaskEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = Objects.requireNonNull(applicationEventPublisher,
                "applicationEventPublisher must not be null");
    }

    @Override
    public void publish(TaskEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("tenantq event listener failed type={} taskId={} tenant={}",
                    event.type(), event.taskId(), event.tenantId(), e);
        }
    }
}
