package io.tenantq.isolation;

import java.util.List;

/**
 * A data-access call that receives the owning tenant id as its mandatory filter.
 */
@FunctionalInterface
public interface TenantQuery<R extends TenantOwned> {

    List<R> execute(String ownerTenantId);
}
