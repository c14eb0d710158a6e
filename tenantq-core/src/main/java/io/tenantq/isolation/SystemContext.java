package io.tenantq.isolation;

import java.util.Objects;
import java.util.Set;

/**
 * Explicit cross-tenant privilege for administrative work. Every use is written to the audit log.
 *
 * @param callerId        who is acting (service or admin identity)
 * @param reason          why cross-tenant access is needed
 * @param affectedTenants tenants touched; empty means "not tenant specific"
 */
public record SystemContext(
        String callerId,
        String reason,
        Set<String> affectedTenants
) {
    public SystemContext {
        Objects.requireNonNull(callerId, "callerId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if (callerId.isBlank()) {
            throw new IllegalArgumentException("callerId must not be blank");
        }
        if (reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be blank");
        }
        affectedTenants = affectedTenants == null ? Set.of() : Set.copyOf(affectedTenants);
    }

    public static SystemContext of(String callerId, String reason) {
        return new SystemContext(callerId, reason, Set.of());
    }
}
