package io.tenantq.retry;

/**
 * Thrown by handlers to send the envelope straight to the dead-letter store.
 */
public class PermanentTaskException extends Exception {

    public PermanentTaskException(String message) {
        super(message);
    }

    public PermanentTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
