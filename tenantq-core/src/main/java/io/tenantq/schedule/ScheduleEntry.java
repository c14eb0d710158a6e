package io.tenantq.schedule;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.tenantq.utils.IntervalParser;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A recurring task definition.
 *
 * <p>{@code payloadTemplate} is rendered per fired envelope; {@code ${tenantId}}, {@code ${fireTime}}
 * and {@code ${entryId}} are substituted. {@code lastFiredWatermark} is the latest fire time
 * whose fan-out completed; it only moves forward.
 */
public record ScheduleEntry(
        String id,
        String cronExpression,
        String timezone,
        String taskType,
        ScheduleScope scope,
        String targetTenantId,
        String payloadTemplate,
        int priority,
        Integer maxRetries,
        boolean enabled,
        Instant lastFiredWatermark
) {

    public ScheduleEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        IntervalParser.validate(cronExpression);
        if (scope == ScheduleScope.SPECIFIC_TENANT && (targetTenantId == null || targetTenantId.isBlank())) {
            throw new IllegalArgumentException("targetTenantId is required for SPECIFIC_TENANT entry " + id);
        }
    }

    public static ScheduleEntry forAllActiveTenants(String id, String cronExpression, String taskType, String payloadTemplate, int priority) {
        return new ScheduleEntry(id, cronExpression, null, taskType, ScheduleScope.ALL_ACTIVE_TENANTS, null,
                payloadTemplate, priority, null, true, null);
    }

    public static ScheduleEntry forTenant(String id, String cronExpression, String taskType, String tenantId, String payloadTemplate, int priority) {
        return new ScheduleEntry(id, cronExpression, null, taskType, ScheduleScope.SPECIFIC_TENANT, tenantId,
                payloadTemplate, priority, null, true, null);
    }

    public ScheduleEntry withWatermark(Instant watermark) {
        return new ScheduleEntry(id, cronExpression, timezone, taskType, scope, targetTenantId,
                payloadTemplate, priority, maxRetries, enabled, watermark);
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }

    /**
     * Substituted values are JSON-string escaped; placeholders are expected inside string literals.
     */
    public String renderPayload(String tenantId, Instant fireTime) {
        String template = payloadTemplate != null ? payloadTemplate : "{}";
        return template
                .replace("${tenantId}", jsonEscaped(tenantId != null ? tenantId : ""))
                .replace("${fireTime}", jsonEscaped(fireTime.toString()))
                .replace("${entryId}", jsonEscaped(id));
    }

    private static String jsonEscaped(String value) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(value));
    }
}
