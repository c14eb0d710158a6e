package io.tenantq.tenant;

/**
 * Receives the external tenant-status-change signal (suspension, reactivation, deletion).
 * Implementations must apply the change before returning.
 */
@FunctionalInterface
public interface TenantStatusListener {

    void onTenantStatusChanged(String tenantId, TenantStatus newStatus);
}
