package io.tenantq.isolation;

import io.tenantq.tenant.TenantContext;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

/**
 * Gate in front of every tenant-scoped data access.
 *
 * <p>Fails closed: without a bound context, with a context that differs from the bound one, or when
 * a query returns a row owned by another tenant, the call aborts with
 * {@link IsolationViolationException}. There is no "all tenants" default. Cross-tenant work goes
 * through {@link #runAsSystem} / {@link #queryAsSystem}, which write an audit record per use.
 */
public class IsolationEnforcer {
    private static final Logger log = LoggerFactory.getLogger(IsolationEnforcer.class);
    private static final Logger audit = LoggerFactory.getLogger("tenantq.audit");

    private final TenantStatusCache statusCache;

    public IsolationEnforcer(TenantStatusCache statusCache) {
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache must not be null");
    }

    /**
     * The tenant bound to the current thread.
     */
    public TenantContext requireBound() {
        return TenantScope.current()
                .orElseThrow(() -> violation(IsolationViolationException.Reason.NO_CONTEXT, null, null,
                        "No tenant context bound to the current thread"));
    }

    /**
     * Admission check before work runs for {@code context}: the tenant must still be ACTIVE
     * according to a fresh cache read (invalidated synchronously on suspension).
     */
    public void admit(TenantContext context) {
        if (context == null) {
            throw violation(IsolationViolationException.Reason.NO_CONTEXT, null, null, "No tenant context to admit");
        }
        Optional<TenantRecord> current = statusCache.lookup(context.tenantId());
        if (current.isEmpty() || !current.get().status().isActive()) {
            throw violation(IsolationViolationException.Reason.TENANT_INACTIVE, context.tenantId(), context.tenantId(),
                    "tenant inactive: " + context.tenantId());
        }
    }

    /**
     * Admission by tenant id, used when a worker restores the context of a claimed envelope. The
     * status is read from the directory, not the cached entry.
     *
     * @return the context built from the fresh tenant record
     */
    public TenantContext admitTenant(String tenantId) {
        if (tenantId == null) {
            throw violation(IsolationViolationException.Reason.NO_CONTEXT, null, null, "Envelope carries no tenant id");
        }
        Optional<TenantRecord> current = statusCache.lookupFresh(tenantId);
        if (current.isEmpty() || !current.get().status().isActive()) {
            throw violation(IsolationViolationException.Reason.TENANT_INACTIVE, tenantId, tenantId,
                    "tenant inactive: " + tenantId);
        }
        return TenantContext.from(current.get());
    }

    /**
     * Runs {@code query} for the tenant bound to the current thread.
     */
    public <R extends TenantOwned> List<R> query(TenantQuery<R> query) {
        return query(query, requireBound());
    }

    /**
     * Runs {@code query} with the tenant id of {@code context} injected as ownership filter and
     * verifies the owner of every returned row.
     */
    public <R extends TenantOwned> List<R> query(TenantQuery<R> query, TenantContext context) {
        Objects.requireNonNull(query, "query must not be null");
        String tenantId = requireMatchingContext(context);

        List<R> rows = query.execute(tenantId);
        if (rows == null) {
            return List.of();
        }
        for (R row : rows) {
            if (row == null) {
                continue;
            }
            if (!tenantId.equals(row.tenantId())) {
                throw violation(IsolationViolationException.Reason.FOREIGN_ROW, tenantId, row.tenantId(),
                        "Query for tenant " + tenantId + " returned a row owned by " + row.tenantId());
            }
        }
        return List.copyOf(rows.stream().filter(Objects::nonNull).toList());
    }

    /**
     * Applies {@code writer} to {@code row} if the row belongs to the bound tenant.
     */
    public <R extends TenantOwned> R write(R row, UnaryOperator<R> writer) {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(writer, "writer must not be null");
        TenantContext bound = requireBound();
        checkOwnership(row, bound);
        R written = writer.apply(row);
        if (written != null && !bound.tenantId().equals(written.tenantId())) {
            throw violation(IsolationViolationException.Reason.FOREIGN_ROW, bound.tenantId(), written.tenantId(),
                    "Write for tenant " + bound.tenantId() + " produced a row owned by " + written.tenantId());
        }
        return written;
    }

    /**
     * Throws when {@code resource} is not owned by {@code context}'s tenant.
     */
    public void checkOwnership(TenantOwned resource, TenantContext context) {
        Objects.requireNonNull(resource, "resource must not be null");
        String tenantId = requireMatchingContext(context);
        if (!tenantId.equals(resource.tenantId())) {
            throw violation(IsolationViolationException.Reason.TENANT_MISMATCH, tenantId, resource.tenantId(),
                    "Tenant " + tenantId + " cannot access resource of tenant " + resource.tenantId());
        }
    }

    /**
     * Non-throwing ownership test, used where a mismatch is an expected answer (status polling).
     */
    public boolean owns(TenantContext context, TenantOwned resource) {
        return context != null && resource != null && context.tenantId().equals(resource.tenantId());
    }

    public <T> T runAsSystem(SystemContext system, Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        recordSystemUse(system, system.affectedTenants());
        return TenantScope.callAsSystem(system, operation);
    }

    /**
     * Cross-tenant read: runs {@code query} once per tenant, each with its own ownership check.
     */
    public <R extends TenantOwned> List<R> queryAsSystem(SystemContext system, Set<String> tenantIds, TenantQuery<R> query) {
        Objects.requireNonNull(tenantIds, "tenantIds must not be null");
        Objects.requireNonNull(query, "query must not be null");
        recordSystemUse(system, tenantIds);

        List<R> all = new ArrayList<>();
        for (String tenantId : tenantIds) {
            List<R> rows = query.execute(tenantId);
            if (rows == null) {
                continue;
            }
            for (R row : rows) {
                if (row != null && !tenantId.equals(row.tenantId())) {
                    throw violation(IsolationViolationException.Reason.FOREIGN_ROW, tenantId, row.tenantId(),
                            "System query for tenant " + tenantId + " returned a row owned by " + row.tenantId());
                }
                if (row != null) {
                    all.add(row);
                }
            }
        }
        return all;
    }

    private void recordSystemUse(SystemContext system, Set<String> tenants) {
        Objects.requireNonNull(system, "system must not be null");
        audit.info("system context used caller={} reason={} tenants={}", system.callerId(), system.reason(), tenants);
    }

    private String requireMatchingContext(TenantContext context) {
        if (context == null) {
            throw violation(IsolationViolationException.Reason.NO_CONTEXT, null, null, "No tenant context supplied");
        }
        Optional<TenantContext> bound = TenantScope.current();
        if (bound.isPresent() && !bound.get().tenantId().equals(context.tenantId())) {
            throw violation(IsolationViolationException.Reason.TENANT_MISMATCH, bound.get().tenantId(), context.tenantId(),
                    "Bound tenant " + bound.get().tenantId() + " does not match requested tenant " + context.tenantId());
        }
        return context.tenantId();
    }

    private IsolationViolationException violation(IsolationViolationException.Reason reason,
                                                  String boundTenantId,
                                                  String offendingTenantId,
                                                  String message) {
        log.error("isolation violation reason={} bound={} offending={} msg={}", reason, boundTenantId, offendingTenantId, message);
        return new IsolationViolationException(reason, boundTenantId, offendingTenantId, message);
    }
}
