package io.tenantq.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tenantq.TaskBuilder;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.Priority;

import java.time.Instant;
import java.util.Objects;

/**
 * Default {@link TaskBuilder}: serializes the payload with Jackson and hands it to the factory.
 */
public class SimpleTaskBuilder<T> implements TaskBuilder<T> {

    private final String tenantId;
    private final String taskType;
    private final T payload;
    private final ObjectMapper objectMapper;
    private final TaskEnvelopeFactory factory;

    private int priority;
    private Integer maxRetries;
    private String idempotencyKey;
    private Instant notBefore;

    public SimpleTaskBuilder(String tenantId,
                             String taskType,
                             T payload,
                             int defaultPriority,
                             ObjectMapper objectMapper,
                             TaskEnvelopeFactory factory) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.taskType = Objects.requireNonNull(taskType, "taskType must not be null");
        this.payload = payload;
        this.priority = defaultPriority;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override
    public TaskBuilder<T> priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public TaskBuilder<T> priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public TaskBuilder<T> maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    @Override
    public TaskBuilder<T> idempotencyKey(String idempotencyKey) {
        Objects.requireNonNull(idempotencyKey, "idempotencyKey must not be null");
        if (idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey must not be blank");
        }
        this.idempotencyKey = idempotencyKey;
        return this;
    }

    @Override
    public TaskBuilder<T> notBefore(Instant notBefore) {
        this.notBefore = Objects.requireNonNull(notBefore, "notBefore must not be null");
        return this;
    }

    @Override
    public EnqueueResult submit() {
        return factory.enqueue(tenantId, taskType, serialize(), priority, maxRetries, idempotencyKey, notBefore);
    }

    private byte[] serialize() {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload of " + taskType + " is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
