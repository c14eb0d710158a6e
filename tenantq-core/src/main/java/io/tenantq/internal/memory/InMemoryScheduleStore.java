package io.tenantq.internal.memory;

import io.tenantq.schedule.ScheduleEntry;
import io.tenantq.spi.ScheduleStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized List<ScheduleEntry> findAll() {
        List<ScheduleEntry> all = new ArrayList<>(entries.values());
        all.sort(Comparator.comparing(ScheduleEntry::id));
        return all;
    }

    @Override
    public synchronized Optional<ScheduleEntry> findById(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public synchronized void save(ScheduleEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.put(entry.id(), entry);
    }

    @Override
    public synchronized boolean advanceWatermark(String entryId, Instant expected, Instant next) {
        Objects.requireNonNull(next, "next must not be null");
        ScheduleEntry current = entries.get(entryId);
        if (current == null) {
            return false;
        }
        Instant watermark = current.lastFiredWatermark();
        if (!Objects.equals(watermark, expected)) {
            return next.equals(watermark);
        }
        if (watermark != null && next.isBefore(watermark)) {
            return false;
        }
        entries.put(entryId, current.withWatermark(next));
        return true;
    }
}
