package io.tenantq.retry;

/**
 * Thrown from a handler that observed a cancel request and stopped.
 */
public class TaskCancelledException extends Exception {

    public TaskCancelledException(String taskId) {
        super("cancelled: " + taskId);
    }
}
