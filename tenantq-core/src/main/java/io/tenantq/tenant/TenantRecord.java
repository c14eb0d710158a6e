package io.tenantq.tenant;

import java.util.Objects;
import java.util.Set;

/**
 * Tenant directory entry.
 *
 * @param tenantId     stable opaque id
 * @param slug         subdomain label used for host based resolution (nullable)
 * @param tier         subscription tier
 * @param status       lifecycle status
 * @param featureFlags enabled capabilities
 */
public record TenantRecord(
        String tenantId,
        String slug,
        TenantTier tier,
        TenantStatus status,
        Set<String> featureFlags
) {
    public TenantRecord {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(status, "status must not be null");
        featureFlags = featureFlags == null ? Set.of() : Set.copyOf(featureFlags);
    }

    public TenantRecord withStatus(TenantStatus newStatus) {
        return new TenantRecord(tenantId, slug, tier, newStatus, featureFlags);
    }
}
