package io.tenantq.core;

public enum DeadLetterReason {
    RETRIES_EXHAUSTED("retries exhausted"),
    PERMANENT_FAILURE("permanent failure"),
    TENANT_INACTIVE("tenant inactive"),
    ISOLATION_VIOLATION("isolation violation");

    private final String description;

    DeadLetterReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
