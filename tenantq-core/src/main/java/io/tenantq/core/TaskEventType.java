package io.tenantq.core;

public enum TaskEventType {
    COMPLETED("task.completed"),
    FAILED("task.failed"),
    DEAD_LETTERED("task.dead_lettered");

    private final String eventName;

    TaskEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
