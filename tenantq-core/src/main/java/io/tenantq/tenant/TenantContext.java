package io.tenantq.tenant;

import java.util.Objects;
import java.util.Set;

/**
 * Identity of the tenant a unit of work runs for.
 *
 * <p>Built per inbound request or per claimed envelope and dropped when that unit of work ends.
 * It is passed explicitly to handlers and bound to the executing thread through
 * {@link io.tenantq.isolation.TenantScope}; it is never kept in a global.
 */
public record TenantContext(
        String tenantId,
        TenantTier tier,
        TenantStatus status,
        Set<String> featureFlags
) {
    public TenantContext {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(status, "status must not be null");
        featureFlags = featureFlags == null ? Set.of() : Set.copyOf(featureFlags);
    }

    public static TenantContext from(TenantRecord record) {
        return new TenantContext(record.tenantId(), record.tier(), record.status(), record.featureFlags());
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean hasFeature(String flag) {
        return featureFlags.contains(flag);
    }
}
