package io.tenantq.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Envelope lifecycle.
 *
 * <pre>
 * PENDING -&gt; IN_PROGRESS -&gt; {COMPLETED | RETRYING | DEAD_LETTERED}
 * RETRYING -&gt; IN_PROGRESS
 * PENDING | RETRYING | IN_PROGRESS -&gt; FAILED   (cancellation)
 * </pre>
 *
 * <p>Nothing ever moves back to {@link #PENDING}.
 */
public enum TaskStatus {
    PENDING {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.of(IN_PROGRESS, FAILED);
        }
    },
    IN_PROGRESS {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.of(COMPLETED, RETRYING, DEAD_LETTERED, FAILED);
        }
    },
    RETRYING {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.of(IN_PROGRESS, FAILED);
        }
    },
    COMPLETED {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.noneOf(TaskStatus.class);
        }
    },
    FAILED {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.noneOf(TaskStatus.class);
        }
    },
    DEAD_LETTERED {
        @Override
        Set<TaskStatus> successors() {
            return EnumSet.noneOf(TaskStatus.class);
        }
    };

    abstract Set<TaskStatus> successors();

    public boolean canTransitionTo(TaskStatus next) {
        return next != null && successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Eligible for a worker claim (subject to {@code notBefore}).
     */
    public boolean isClaimable() {
        return this == PENDING || this == RETRYING;
    }

    /**
     * Lower-case name used in events and status responses (e.g. "dead_lettered").
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
