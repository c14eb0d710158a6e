package io.tenantq.schedule;

import io.tenantq.config.TaskQueueProperties;
import io.tenantq.core.EnqueueResult;
import io.tenantq.internal.TaskEnvelopeFactory;
import io.tenantq.spi.ScheduleStore;
import io.tenantq.spi.TenantDirectory;
import io.tenantq.tenant.AuthenticationException;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.utils.IdempotencyKeys;
import io.tenantq.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires recurring envelopes from {@link ScheduleEntry} definitions.
 *
 * <p>Each tick looks at the fire times in {@code (lastFiredWatermark, now]}. Only the latest one is
 * fired; earlier ones are reported as missed and skipped. The watermark is advanced after the
 * fan-out, so a crash in between re-fires the same fire time on the next tick. Every fired envelope
 * carries the key {@code schedule:<entryId>:<fireTime>}, which makes a re-fire collapse onto the
 * envelopes that are still open.
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    // bound on fire times scanned per entry and tick
    static final int MAX_SCAN = 100_000;

    private final TaskQueueProperties props;
    private final ScheduleStore scheduleStore;
    private final TenantDirectory tenantDirectory;
    private final TaskEnvelopeFactory factory;
    private final SchedulerListener listener;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread tickThread;
    private int systemErrorCount = 0;

    public Scheduler(TaskQueueProperties props,
                     ScheduleStore scheduleStore,
                     TenantDirectory tenantDirectory,
                     TaskEnvelopeFactory factory,
                     SchedulerListener listener,
                     Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.tenantDirectory = Objects.requireNonNull(tenantDirectory, "tenantDirectory must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.listener = listener != null ? listener : new LoggingSchedulerListener();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Duration tick = Objects.requireNonNull(props.getSchedulerTick(), "tenantq.schedulerTick must not be null");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tenantq.schedulerTick must be a positive duration");
        }
        tickThread = new Thread(this::tickLoop);
        tickThread.setName("tenantq.scheduler");
        tickThread.setDaemon(true);
        tickThread.start();
        log.info("tenantq scheduler started tick={} fanOutPageSize={}", tick, props.getFanOutPageSize());
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (tickThread != null) {
            tickThread.interrupt();
            tickThread = null;
        }
        log.info("tenantq scheduler stopped");
    }

    /**
     * Evaluates every entry once. A failing entry is logged and left for the next tick.
     */
    public void tick() {
        Instant now = clock.instant();
        for (ScheduleEntry entry : scheduleStore.findAll()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            try {
                evaluate(entry, now);
            } catch (RuntimeException e) {
                log.error("tenantq scheduler entry failed entry={} taskType={} msg={}", entry.id(), entry.taskType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return the fire time that was fired, or null when nothing was due
     */
    public Instant evaluate(ScheduleEntry entry, Instant now) {
        if (!entry.enabled()) {
            return null;
        }
        Instant watermark = entry.lastFiredWatermark();
        if (watermark == null) {
            // new entry: start counting from now, nothing is due retroactively
            scheduleStore.advanceWatermark(entry.id(), null, now);
            return null;
        }

        Instant first = null;
        Instant lastMissed = null;
        Instant latest = null;
        int due = 0;
        Instant cursor = watermark;
        while (due < MAX_SCAN) {
            Instant next = IntervalParser.nextFireTime(entry.cronExpression(), entry.zone(), cursor);
            if (next.isAfter(now)) {
                break;
            }
            if (first == null) {
                first = next;
            }
            lastMissed = latest;
            latest = next;
            due++;
            cursor = next;
        }
        if (latest == null) {
            return null;
        }
        if (due > 1) {
            listener.onMissedTicks(entry, due - 1, first, lastMissed);
        }

        if (!fire(entry, latest)) {
            return null;
        }
        if (!scheduleStore.advanceWatermark(entry.id(), watermark, latest)) {
            log.debug("tenantq scheduler watermark moved concurrently entry={} expected={} next={}", entry.id(), watermark, latest);
        }
        return latest;
    }

    /**
     * @return false when the fan-out was interrupted and must be repeated
     */
    private boolean fire(ScheduleEntry entry, Instant fireTime) {
        int[] counts = new int[2];
        switch (entry.scope()) {
            case SPECIFIC_TENANT -> fireFor(entry, entry.targetTenantId(), fireTime, counts);
            case ALL_ACTIVE_TENANTS -> {
                int pageSize = Math.max(1, props.getFanOutPageSize());
                String after = null;
                while (true) {
                    List<TenantRecord> page = tenantDirectory.listActiveTenants(after, pageSize);
                    for (TenantRecord tenant : page) {
                        fireFor(entry, tenant.tenantId(), fireTime, counts);
                    }
                    if (page.size() < pageSize) {
                        break;
                    }
                    after = page.get(page.size() - 1).tenantId();
                    if (!pauseBetweenPages()) {
                        return false;
                    }
                }
            }
        }
        listener.onFired(entry, fireTime, counts[0], counts[1]);
        return true;
    }

    private void fireFor(ScheduleEntry entry, String tenantId, Instant fireTime, int[] counts) {
        byte[] payload = entry.renderPayload(tenantId, fireTime).getBytes(StandardCharsets.UTF_8);
        try {
            EnqueueResult result = factory.enqueue(tenantId, entry.taskType(), payload, entry.priority(),
                    entry.maxRetries(), IdempotencyKeys.forScheduleFire(entry.id(), fireTime), null);
            counts[result.created() ? 0 : 1]++;
        } catch (AuthenticationException e) {
            // tenant left ACTIVE between listing and enqueue
            log.info("tenantq scheduler skipped tenant entry={} tenant={} msg={}", entry.id(), tenantId, e.getMessage());
        }
    }

    private boolean pauseBetweenPages() {
        Duration pause = props.getFanOutPagePause();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void tickLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("tenantq scheduler tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getSchedulerTick().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
