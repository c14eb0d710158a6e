package io.tenantq.isolation;

/**
 * Data access was attempted without a correctly bound tenant context.
 *
 * <p>Never caught to fall back to a wider scope.
 */
public class IsolationViolationException extends RuntimeException {

    public enum Reason {
        NO_CONTEXT,
        TENANT_MISMATCH,
        FOREIGN_ROW,
        TENANT_INACTIVE
    }

    private final Reason reason;
    private final String boundTenantId;
    private final String offendingTenantId;

    public IsolationViolationException(Reason reason, String boundTenantId, String offendingTenantId, String message) {
        super(message);
        this.reason = reason;
        this.boundTenantId = boundTenantId;
        this.offendingTenantId = offendingTenantId;
    }

    public Reason reason() {
        return reason;
    }

    public String boundTenantId() {
        return boundTenantId;
    }

    public String offendingTenantId() {
        return offendingTenantId;
    }
}
