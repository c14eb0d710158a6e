package io.tenantq.spi;

import io.tenantq.tenant.TenantRecord;

import java.util.List;
import java.util.Optional;

/**
 * Source of truth for tenant metadata. Owned by the tenant administration layer.
 */
public interface TenantDirectory {

    Optional<TenantRecord> findTenant(String tenantId);

    Optional<TenantRecord> findBySlug(String slug);

    /**
     * Keyset page of ACTIVE tenants ordered by tenant id.
     *
     * @param afterTenantId exclusive lower bound, or null for the first page
     * @param limit         max page size
     */
    List<TenantRecord> listActiveTenants(String afterTenantId, int limit);
}
