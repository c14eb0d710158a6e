package io.tenantq.tenant;

public enum TenantTier {
    FREE,
    BASIC,
    PROFESSIONAL,
    ENTERPRISE
}
