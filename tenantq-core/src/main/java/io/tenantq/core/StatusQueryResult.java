package io.tenantq.core;

import java.util.Optional;

/**
 * Answer to a status poll. {@link #result()} is present only for {@link Outcome#FOUND}.
 */
public record StatusQueryResult(
        Outcome outcome,
        Optional<TaskResult> result
) {

    public enum Outcome {
        FOUND,
        NOT_FOUND,
        FORBIDDEN
    }

    public static StatusQueryResult found(TaskResult result) {
        return new StatusQueryResult(Outcome.FOUND, Optional.of(result));
    }

    public static StatusQueryResult notFound() {
        return new StatusQueryResult(Outcome.NOT_FOUND, Optional.empty());
    }

    public static StatusQueryResult forbidden() {
        return new StatusQueryResult(Outcome.FORBIDDEN, Optional.empty());
    }
}
