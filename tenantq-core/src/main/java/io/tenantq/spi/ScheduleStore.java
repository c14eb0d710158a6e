package io.tenantq.spi;

import io.tenantq.schedule.ScheduleEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    List<ScheduleEntry> findAll();

    Optional<ScheduleEntry> findById(String id);

    void save(ScheduleEntry entry);

    /**
     * Moves the watermark from {@code expected} to {@code next} if it has not changed meanwhile.
     * Never moves it backwards.
     *
     * @param expected current watermark, may be null for an entry that never fired
     * @return true when the watermark now equals {@code next}
     */
    boolean advanceWatermark(String entryId, Instant expected, Instant next);
}
