package io.tenantq.routing;

import io.tenantq.tenant.TenantTier;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of the binding table: {@code (taskTypePattern, tierFilter) -> queueName}.
 *
 * <p>Patterns are literal task types or globs where {@code *} matches any run of characters.
 * A {@code null} tier filter matches every tier, including system-scoped envelopes (no tier).
 */
public final class QueueBinding {

    public static final String WILDCARD = "*";

    private static final int EXACT_PATTERN_SCORE = 1_000_000;

    private final String taskTypePattern;
    private final TenantTier tierFilter;
    private final String queueName;
    private final Pattern compiled;

    public QueueBinding(String taskTypePattern, TenantTier tierFilter, String queueName) {
        this.taskTypePattern = Objects.requireNonNull(taskTypePattern, "taskTypePattern must not be null");
        this.queueName = Objects.requireNonNull(queueName, "queueName must not be null");
        if (taskTypePattern.isBlank()) {
            throw new IllegalArgumentException("taskTypePattern must not be blank");
        }
        if (queueName.isBlank()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
        this.tierFilter = tierFilter;
        this.compiled = compileGlob(taskTypePattern);
    }

    public static QueueBinding catchAll(String queueName) {
        return new QueueBinding(WILDCARD, null, queueName);
    }

    public String taskTypePattern() {
        return taskTypePattern;
    }

    public TenantTier tierFilter() {
        return tierFilter;
    }

    public String queueName() {
        return queueName;
    }

    public boolean isCatchAll() {
        return WILDCARD.equals(taskTypePattern) && tierFilter == null;
    }

    public boolean matches(String taskType, TenantTier tier) {
        if (tierFilter != null && tierFilter != tier) {
            return false;
        }
        return compiled.matcher(taskType).matches();
    }

    /**
     * Higher is more specific. Exact patterns beat globs, globs with more literal characters beat
     * shorter ones, and a tier filter breaks a tie between equal patterns.
     */
    public int specificity() {
        int patternScore = taskTypePattern.contains(WILDCARD)
                ? taskTypePattern.replace(WILDCARD, "").length()
                : EXACT_PATTERN_SCORE;
        return patternScore * 2 + (tierFilter != null ? 1 : 0);
    }

    private static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "QueueBinding{" + taskTypePattern + ", tier=" + (tierFilter == null ? "any" : tierFilter) + " -> " + queueName + '}';
    }
}
