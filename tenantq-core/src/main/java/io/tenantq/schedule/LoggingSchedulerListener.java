package io.tenantq.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public class LoggingSchedulerListener implements SchedulerListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingSchedulerListener.class);

    @Override
    public void onMissedTicks(ScheduleEntry entry, int missedCount, Instant firstMissed, Instant lastMissed) {
        log.warn("tenantq scheduler missed ticks entry={} taskType={} missed={} from={} to={}",
                entry.id(), entry.taskType(), missedCount, firstMissed, lastMissed);
    }

    @Override
    public void onFired(ScheduleEntry entry, Instant fireTime, int envelopesCreated, int envelopesDeduplicated) {
        log.info("tenantq scheduler fired entry={} taskType={} fireTime={} created={} deduplicated={}",
                entry.id(), entry.taskType(), fireTime, envelopesCreated, envelopesDeduplicated);
    }
}
