package io.tenantq.retry;

public enum FailureKind {
    /** Worth another attempt: timeouts, network errors, unavailable dependencies. */
    TRANSIENT,
    /** Retrying cannot help: malformed payload, validation or business rule failure. */
    PERMANENT
}
