package io.tenantq.schedule;

public enum ScheduleScope {
    /** One envelope per tenant that is ACTIVE at fire time. */
    ALL_ACTIVE_TENANTS,
    /** One envelope for {@link ScheduleEntry#targetTenantId()}. */
    SPECIFIC_TENANT
}
