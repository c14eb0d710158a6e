package io.tenantq.internal.memory;

import io.tenantq.spi.TenantDirectory;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatus;
import io.tenantq.tenant.TenantStatusListener;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tenant directory held in memory. Status changes notify the registered listeners synchronously.
 */
public class InMemoryTenantDirectory implements TenantDirectory {

    private final Map<String, TenantRecord> tenants = new ConcurrentHashMap<>();
    private final List<TenantStatusListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryTenantDirectory put(TenantRecord tenant) {
        Objects.requireNonNull(tenant, "tenant must not be null");
        tenants.put(tenant.tenantId(), tenant);
        return this;
    }

    public void addListener(TenantStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void updateStatus(String tenantId, TenantStatus status) {
        TenantRecord current = tenants.get(tenantId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown tenant: " + tenantId);
        }
        tenants.put(tenantId, current.withStatus(status));
        listeners.forEach(l -> l.onTenantStatusChanged(tenantId, status));
    }

    @Override
    public Optional<TenantRecord> findTenant(String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Optional<TenantRecord> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return tenants.values().stream().filter(t -> slug.equals(t.slug())).findFirst();
    }

    @Override
    public List<TenantRecord> listActiveTenants(String afterTenantId, int limit) {
        return tenants.values().stream()
                .filter(t -> t.status().isActive())
                .filter(t -> afterTenantId == null || t.tenantId().compareTo(afterTenantId) > 0)
                .sorted(Comparator.comparing(TenantRecord::tenantId))
                .limit(limit)
                .toList();
    }
}
