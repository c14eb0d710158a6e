package io.tenantq.tenant;

import io.tenantq.spi.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache in front of the {@link TenantDirectory}.
 *
 * <p>Read-shared, write-invalidated. {@link #invalidate(String)} is synchronous: once it returns,
 * no lookup serves the old entry. Each tenant has a generation counter that is bumped on
 * invalidation; a load that started before the bump is not cached, so a slow directory read
 * cannot put a stale ACTIVE entry back after a suspension.
 */
public class TenantStatusCache implements TenantStatusListener {
    private static final Logger log = LoggerFactory.getLogger(TenantStatusCache.class);

    private final TenantDirectory directory;
    private final Duration ttl;
    private final Clock clock;

    private final ConcurrentHashMap<String, CachedTenant> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    private record CachedTenant(TenantRecord record, Instant expiresAt) {
    }

    public TenantStatusCache(TenantDirectory directory, Duration ttl, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
    }

    public Optional<TenantRecord> lookup(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Instant now = clock.instant();

        CachedTenant cached = entries.get(tenantId);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return Optional.of(cached.record());
        }
        return load(tenantId, now);
    }

    /**
     * Reads the directory regardless of the cached entry and refreshes it. Used before an attempt
     * runs, so a status change whose signal was lost still stops the next attempt.
     */
    public Optional<TenantRecord> lookupFresh(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        return load(tenantId, clock.instant());
    }

    private Optional<TenantRecord> load(String tenantId, Instant now) {
        AtomicLong generation = generations.computeIfAbsent(tenantId, k -> new AtomicLong());
        long seen = generation.get();

        Optional<TenantRecord> loaded = directory.findTenant(tenantId);
        if (loaded.isEmpty()) {
            entries.remove(tenantId);
            return Optional.empty();
        }

        CachedTenant fresh = new CachedTenant(loaded.get(), now.plus(ttl));
        entries.compute(tenantId, (k, existing) -> generation.get() == seen ? fresh : existing);
        return loaded;
    }

    /**
     * Returns the tenant when it exists and is ACTIVE.
     *
     * @throws AuthenticationException when unknown, suspended or deleted
     */
    public TenantRecord requireActive(String tenantId) {
        TenantRecord record = lookup(tenantId)
                .orElseThrow(() -> new AuthenticationException("Unknown tenant: " + tenantId, tenantId));
        if (!record.status().isActive()) {
            throw new AuthenticationException("Tenant is " + record.status().name().toLowerCase()
                    + ": " + tenantId, tenantId);
        }
        return record;
    }

    public void invalidate(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        generations.computeIfAbsent(tenantId, k -> new AtomicLong()).incrementAndGet();
        entries.remove(tenantId);
    }

    public void invalidateAll() {
        generations.values().forEach(AtomicLong::incrementAndGet);
        entries.clear();
    }

    @Override
    public void onTenantStatusChanged(String tenantId, TenantStatus newStatus) {
        invalidate(tenantId);
        log.info("tenant status changed tenantId={} status={}; cache entry invalidated", tenantId, newStatus);
    }
}
