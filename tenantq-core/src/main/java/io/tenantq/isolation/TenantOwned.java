package io.tenantq.isolation;

/**
 * Any row or record that belongs to exactly one tenant.
 */
public interface TenantOwned {

    /**
     * Owning tenant id; {@code null} only for system-scoped records.
     */
    String tenantId();
}
