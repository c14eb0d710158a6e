package io.tenantq.tenant;

public enum TenantStatus {
    ACTIVE,
    SUSPENDED,
    DELETED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
