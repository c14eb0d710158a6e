package io.tenantq.tenant;

import io.tenantq.config.TaskQueueProperties;
import io.tenantq.spi.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolves the {@link TenantContext} of an inbound request.
 *
 * <p>Sources, first applicable wins:
 * <ol>
 *   <li>the tenant header, honoured for privileged callers</li>
 *   <li>the tenant claim of the authenticated token</li>
 *   <li>the subdomain of the request host below {@code tenantq.base-domain}</li>
 * </ol>
 *
 * <p>A header that disagrees with the token claim is rejected; the resolver never picks one of
 * two conflicting values. Suspended and deleted tenants are rejected here, before anything runs.
 */
public class TenantContextResolver {
    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);

    private final TenantStatusCache statusCache;
    private final TenantDirectory directory;
    private final String headerName;
    private final String claimName;
    private final String baseDomain;

    public TenantContextResolver(TaskQueueProperties props, TenantStatusCache statusCache, TenantDirectory directory) {
        Objects.requireNonNull(props, "props must not be null");
        this.statusCache = Objects.requireNonNull(statusCache, "statusCache must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.headerName = Objects.requireNonNull(props.getTenantHeader(), "tenantq.tenantHeader must not be null");
        this.claimName = Objects.requireNonNull(props.getTenantClaim(), "tenantq.tenantClaim must not be null");
        this.baseDomain = isBlank(props.getBaseDomain()) ? null : props.getBaseDomain().trim().toLowerCase(Locale.ROOT);
    }

    public TenantContext resolve(RequestDescriptor request) {
        Objects.requireNonNull(request, "request must not be null");

        String headerTenant = trimToNull(request.header(headerName));
        String claimTenant = trimToNull(request.claim(claimName));

        if (headerTenant != null && claimTenant != null && !headerTenant.equals(claimTenant)) {
            log.warn("tenant resolution rejected: header tenant={} conflicts with token tenant={}", headerTenant, claimTenant);
            throw new AuthenticationException("Tenant header conflicts with token claim");
        }
        if (headerTenant != null && !request.privileged() && claimTenant == null) {
            log.warn("tenant resolution rejected: unprivileged caller sent tenant header tenant={}", headerTenant);
            throw new AuthenticationException("Tenant header requires a privileged caller", headerTenant);
        }

        String tenantId;
        if (headerTenant != null) {
            tenantId = headerTenant;
        } else if (claimTenant != null) {
            tenantId = claimTenant;
        } else {
            tenantId = tenantFromHost(request.normalizedHost());
        }

        if (tenantId == null) {
            throw new AuthenticationException("No tenant could be resolved from the request");
        }

        TenantRecord record = statusCache.requireActive(tenantId);
        return TenantContext.from(record);
    }

    private String tenantFromHost(String host) {
        if (host == null || baseDomain == null) {
            return null;
        }
        String suffix = "." + baseDomain;
        if (!host.endsWith(suffix)) {
            return null;
        }
        String label = host.substring(0, host.length() - suffix.length());
        if (label.isEmpty() || label.contains(".")) {
            return null;
        }
        return directory.findBySlug(label)
                .map(TenantRecord::tenantId)
                .orElseThrow(() -> new AuthenticationException("Unknown tenant subdomain: " + label));
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
