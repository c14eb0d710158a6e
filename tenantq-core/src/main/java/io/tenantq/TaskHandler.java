package io.tenantq;

import io.tenantq.retry.DefaultFailureClassifier;
import io.tenantq.retry.FailureKind;

import java.time.Duration;

/**
 * Executes envelopes of one task type.
 *
 * <p>The payload is deserialized with Jackson into {@link #payloadClass()}; the returned value (may be
 * null) is serialized with Jackson into the task result. Handlers run with the envelope's tenant bound,
 * available from {@link TaskExecution#tenant()}.
 */
public interface TaskHandler<T> {

    String taskType();

    Class<T> payloadClass();

    Object execute(T payload, TaskExecution execution) throws Exception;

    /**
     * Time limit for one attempt. Null means the configured default.
     */
    default Duration timeout() {
        return null;
    }

    /**
     * Error taxonomy of this handler. Override to mark domain errors permanent or transient.
     */
    default FailureKind classify(Throwable error) {
        return DefaultFailureClassifier.INSTANCE.classify(error);
    }
}
