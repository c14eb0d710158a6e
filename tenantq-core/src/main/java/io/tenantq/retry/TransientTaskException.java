package io.tenantq.retry;

/**
 * Thrown by handlers to mark a failure as retryable regardless of the cause.
 */
public class TransientTaskException extends Exception {

    public TransientTaskException(String message) {
        super(message);
    }

    public TransientTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
