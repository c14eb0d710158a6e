package io.tenantq.core;

/**
 * Outcome of an enqueue call.
 *
 * created : true when a new envelope was stored
 * false   : an open envelope with the same idempotency key already existed and its id is returned
 */
public record EnqueueResult(
        String taskId,
        boolean created
) {
    public static EnqueueResult createdResult(String taskId) {
        return new EnqueueResult(taskId, true);
    }

    public static EnqueueResult deduplicated(String existingTaskId) {
        return new EnqueueResult(existingTaskId, false);
    }
}
