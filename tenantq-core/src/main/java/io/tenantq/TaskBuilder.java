package io.tenantq;

import io.tenantq.core.EnqueueResult;
import io.tenantq.core.Priority;

import java.time.Instant;

/**
 * Fluent builder for a single envelope. Nothing is stored until {@link #submit()}.
 */
public interface TaskBuilder<T> {

    TaskBuilder<T> priority(Priority priority);

    /**
     * Raw priority value, higher runs first.
     */
    TaskBuilder<T> priority(int priority);

    TaskBuilder<T> maxRetries(int maxRetries);

    /**
     * Explicit idempotency key. When absent the key is derived from tenant, task type and payload.
     */
    TaskBuilder<T> idempotencyKey(String idempotencyKey);

    /**
     * Earliest execution time.
     */
    TaskBuilder<T> notBefore(Instant notBefore);

    EnqueueResult submit();
}
