package io.tenantq.routing;

import io.tenantq.config.TaskQueueProperties;
import io.tenantq.tenant.TenantTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Maps {@code (taskType, tier)} to a queue name.
 *
 * <p>Pure and deterministic: the most specific matching binding wins (see
 * {@link QueueBinding#specificity()}); between equally specific bindings the one declared first
 * wins. The table is versioned through {@code tenantq.bindings-version} so a change in
 * declaration order is visible in logs.
 */
public final class QueueRouter {
    private static final Logger log = LoggerFactory.getLogger(QueueRouter.class);

    private final List<QueueBinding> bindings;
    private final String version;

    public QueueRouter(List<QueueBinding> bindings, String version) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        this.bindings = List.copyOf(bindings);
        this.version = version == null ? "unversioned" : version;
        if (this.bindings.stream().noneMatch(QueueBinding::isCatchAll)) {
            throw new IllegalArgumentException("Queue binding table must declare a catch-all binding ('*', any tier)");
        }
        log.info("Queue router initialised version={} bindings={}", this.version, this.bindings);
    }

    public String route(String taskType, TenantTier tier) {
        Objects.requireNonNull(taskType, "taskType must not be null");

        QueueBinding best = null;
        int bestScore = -1;
        for (QueueBinding binding : bindings) {
            if (!binding.matches(taskType, tier)) {
                continue;
            }
            int score = binding.specificity();
            if (score > bestScore) {
                best = binding;
                bestScore = score;
            }
        }
        // unreachable while a catch-all is declared
        if (best == null) {
            throw new IllegalStateException("No queue binding matched taskType=" + taskType);
        }
        return best.queueName();
    }

    public Set<String> queueNames() {
        Set<String> names = new LinkedHashSet<>();
        for (QueueBinding b : bindings) {
            names.add(b.queueName());
        }
        return names;
    }

    public List<QueueBinding> bindings() {
        return bindings;
    }

    public String version() {
        return version;
    }

    /**
     * Builds the router from {@code tenantq.bindings}; falls back to {@link #defaultBindings()}
     * when none are configured.
     */
    public static QueueRouter fromProperties(TaskQueueProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        List<TaskQueueProperties.Binding> configured = props.getBindings();
        if (configured == null || configured.isEmpty()) {
            return new QueueRouter(defaultBindings(), props.getBindingsVersion());
        }
        List<QueueBinding> bindings = new ArrayList<>(configured.size());
        for (TaskQueueProperties.Binding b : configured) {
            TenantTier tier = (b.getTier() == null || b.getTier().isBlank())
                    ? null
                    : TenantTier.valueOf(b.getTier().trim().toUpperCase(Locale.ROOT));
            bindings.add(new QueueBinding(b.getPattern(), tier, b.getQueue()));
        }
        return new QueueRouter(bindings, props.getBindingsVersion());
    }

    /**
     * Default table. Notifications and content generation are latency sensitive; reports,
     * analytics and maintenance run in the background, except reports for enterprise tenants.
     */
    public static List<QueueBinding> defaultBindings() {
        return List.of(
                new QueueBinding("send_*", null, "high_priority"),
                new QueueBinding("generate_content*", null, "high_priority"),
                new QueueBinding("generate_report", TenantTier.ENTERPRISE, "default"),
                new QueueBinding("generate_report", null, "low_priority"),
                new QueueBinding("aggregate_*", null, "low_priority"),
                new QueueBinding("cleanup_*", null, "low_priority"),
                QueueBinding.catchAll("default")
        );
    }
}
