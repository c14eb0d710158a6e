package io.tenantq.config;

import io.tenantq.core.TaskEvent;
import io.tenantq.core.TaskEventType;
import io.tenantq.core.TaskStatus;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringTaskEventPublisherTest {

    private final ApplicationEventPublisher delegate = mock(ApplicationEventPublisher.class);
    private final SpringTaskEventPublisher publisher = new SpringTaskEventPublisher(delegate);

    private final TaskEvent event = new TaskEvent(TaskEventType.COMPLETED, "t-1", "org-a", "send_email",
            TaskStatus.COMPLETED, 0, null, Instant.parse("2026-01-01T00:00:00Z"));

    @Test
    void shouldRepublishAsApplicationEvent() {
        publisher.publish(event);

        verify(delegate).publishEvent(event);
    }

    @Test
    void shouldNotPropagateListenerFailures() {
        doThrow(new IllegalStateException("listener down")).when(delegate).publishEvent(any(Object.class));

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();
    }
}
