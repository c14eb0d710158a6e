package io.tenantq.schedule;

import java.time.Instant;

/**
 * Operational hooks of the scheduler.
 */
public interface SchedulerListener {

    /**
     * Fire times that were due but skipped because a later one was due as well.
     *
     * @param firstMissed earliest skipped fire time
     * @param lastMissed  latest skipped fire time
     */
    void onMissedTicks(ScheduleEntry entry, int missedCount, Instant firstMissed, Instant lastMissed);

    default void onFired(ScheduleEntry entry, Instant fireTime, int envelopesCreated, int envelopesDeduplicated) {
    }
}
