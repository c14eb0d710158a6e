package io.tenantq.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskEnvelopeTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static TaskEnvelope pending(int maxRetries) {
        return TaskEnvelope.pending("t-1", "tenant-a", false, "send_email", "high_priority", "k",
                new byte[]{1, 2, 3}, 5, maxRetries, null, T0);
    }

    @Test
    void newEnvelopeStartsPendingAndEligibleNow() {
        TaskEnvelope e = pending(3);

        assertEquals(TaskStatus.PENDING, e.status());
        assertEquals(T0, e.notBefore());
        assertEquals(0, e.retryCount());
        assertFalse(e.cancelRequested());
    }

    @Test
    void tenantIdIsRequiredUnlessSystemScoped() {
        assertThrows(IllegalArgumentException.class, () -> TaskEnvelope.pending("t", null, false, "x", "default", "k",
                new byte[0], 5, 3, null, T0));

        TaskEnvelope system = TaskEnvelope.pending("t", null, true, "x", "default", "k", new byte[0], 5, 3, null, T0);
        assertEquals("system", system.owner());
    }

    @Test
    void happyPathMovesThroughInProgressToCompleted() {
        TaskEnvelope claimed = pending(3).claimed("w1", T0.plusSeconds(60), T0);
        assertEquals(TaskStatus.IN_PROGRESS, claimed.status());
        assertEquals("w1", claimed.lockedBy());

        TaskEnvelope done = claimed.completed(T0.plusSeconds(1));
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(null, done.lockedBy());
        assertTrue(done.status().isTerminal());
    }

    @Test
    void retryingReleasesTheLeaseAndCanBeClaimedAgain() {
        TaskEnvelope retrying = pending(3).claimed("w1", T0.plusSeconds(60), T0)
                .retrying(1, T0.plusSeconds(20), "boom", T0);

        assertEquals(TaskStatus.RETRYING, retrying.status());
        assertEquals(1, retrying.retryCount());
        assertEquals("boom", retrying.lastError());
        assertEquals(null, retrying.lockedBy());
        assertTrue(retrying.status().isClaimable());

        TaskEnvelope again = retrying.claimed("w2", T0.plusSeconds(80), T0.plusSeconds(20));
        assertEquals(TaskStatus.IN_PROGRESS, again.status());
        assertEquals(1, again.retryCount());
    }

    @Test
    void retryCountReachingMaxOnlyAllowsDeadLetter() {
        TaskEnvelope claimed = pending(2).claimed("w1", T0.plusSeconds(60), T0)
                .retrying(1, T0, "e1", T0)
                .claimed("w1", T0.plusSeconds(60), T0);

        assertThrows(IllegalStateException.class, () -> claimed.retrying(2, T0, "e2", T0));

        TaskEnvelope dead = claimed.deadLettered(2, "e2", T0);
        assertEquals(TaskStatus.DEAD_LETTERED, dead.status());
        assertEquals(2, dead.retryCount());
    }

    @Test
    void retryCountNeverDecreasesNorExceedsMax() {
        TaskEnvelope claimed = pending(3).claimed("w1", T0.plusSeconds(60), T0)
                .retrying(2, T0, "e", T0)
                .claimed("w1", T0.plusSeconds(60), T0);

        assertThrows(IllegalStateException.class, () -> claimed.deadLettered(1, "e", T0));
        assertThrows(IllegalStateException.class, () -> claimed.deadLettered(4, "e", T0));
    }

    @Test
    void pendingCannotCompleteWithoutBeingClaimed() {
        assertThrows(IllegalStateException.class, () -> pending(3).completed(T0));
        assertThrows(IllegalStateException.class, () -> pending(3).retrying(1, T0, "e", T0));
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED", "DEAD_LETTERED"})
    void terminalStatesHaveNoSuccessors(TaskStatus terminal) {
        assertTrue(terminal.isTerminal());
        for (TaskStatus next : TaskStatus.values()) {
            assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
        }
    }

    @Test
    void nothingReturnsToPending() {
        for (TaskStatus from : TaskStatus.values()) {
            assertFalse(from.canTransitionTo(TaskStatus.PENDING), from + " -> PENDING");
        }
    }

    @Test
    void cancellationFailsAnyOpenEnvelope() {
        TaskEnvelope failed = pending(3).failed("cancelled", T0);
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals("cancelled", failed.lastError());
    }

    @Test
    void wireNameIsLowerCase() {
        assertEquals("dead_lettered", TaskStatus.DEAD_LETTERED.wireName());
        assertEquals("in_progress", TaskStatus.IN_PROGRESS.wireName());
    }
}
