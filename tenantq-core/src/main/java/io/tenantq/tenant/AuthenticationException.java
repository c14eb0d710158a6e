package io.tenantq.tenant;

/**
 * Tenant resolution failed: no usable source, conflicting sources, unknown tenant, or a tenant
 * that is suspended or deleted. Surfaced to the caller as a rejection and never retried.
 */
public class AuthenticationException extends RuntimeException {

    private final String tenantId;

    public AuthenticationException(String message) {
        this(message, null);
    }

    public AuthenticationException(String message, String tenantId) {
        super(message);
        this.tenantId = tenantId;
    }

    /**
     * Tenant the failure refers to, when one was identified.
     */
    public String tenantId() {
        return tenantId;
    }
}
