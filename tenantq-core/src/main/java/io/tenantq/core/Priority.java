package io.tenantq.core;

/**
 * Named priority levels. Higher values are claimed first within a queue.
 */
public enum Priority {

    URGENT(9),
    HIGH(7),
    NORMAL(5),
    LOW(3),
    BACKGROUND(0);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
