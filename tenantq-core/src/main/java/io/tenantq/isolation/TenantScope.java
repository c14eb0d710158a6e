package io.tenantq.isolation;

import io.tenantq.tenant.TenantContext;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Thread-scoped binding of the tenant (or system) context for one unit of work.
 *
 * <p>Bindings only exist inside {@link #callWith} / {@link #callAsSystem} and are always restored
 * in {@code finally}, so nothing leaks from one task to the next on a pooled thread. Re-binding a
 * different tenant inside an active scope is refused.
 */
public final class TenantScope {

    private record Binding(TenantContext tenant, SystemContext system) {
    }

    private static final ThreadLocal<Binding> CURRENT = new ThreadLocal<>();

    private TenantScope() {
    }

    public static Optional<TenantContext> current() {
        Binding b = CURRENT.get();
        return b == null ? Optional.empty() : Optional.ofNullable(b.tenant());
    }

    public static Optional<SystemContext> currentSystem() {
        Binding b = CURRENT.get();
        return b == null ? Optional.empty() : Optional.ofNullable(b.system());
    }

    public static boolean isBound() {
        return CURRENT.get() != null;
    }

    public static <T> T callWith(TenantContext context, Callable<T> body) throws Exception {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(body, "body must not be null");

        Binding previous = CURRENT.get();
        if (previous != null && (previous.tenant() == null
                || !previous.tenant().tenantId().equals(context.tenantId()))) {
            throw new IsolationViolationException(
                    IsolationViolationException.Reason.TENANT_MISMATCH,
                    previous.tenant() == null ? "system" : previous.tenant().tenantId(),
                    context.tenantId(),
                    "Cannot bind tenant " + context.tenantId() + " inside an active scope");
        }

        CURRENT.set(new Binding(context, null));
        try {
            return body.call();
        } finally {
            restore(previous);
        }
    }

    public static void runWith(TenantContext context, Runnable body) {
        try {
            callWith(context, () -> {
                body.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    static <T> T callAsSystem(SystemContext system, Callable<T> body) throws Exception {
        Objects.requireNonNull(system, "system must not be null");
        Binding previous = CURRENT.get();
        if (previous != null && previous.system() == null) {
            throw new IsolationViolationException(
                    IsolationViolationException.Reason.TENANT_MISMATCH,
                    previous.tenant().tenantId(),
                    "system",
                    "Cannot enter system context from tenant scope " + previous.tenant().tenantId());
        }
        CURRENT.set(new Binding(null, system));
        try {
            return body.call();
        } finally {
            restore(previous);
        }
    }

    private static void restore(Binding previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
