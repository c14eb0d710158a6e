package io.tenantq.internal.memory;

import io.tenantq.core.EnqueueResult;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskStatus;
import io.tenantq.spi.TaskStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TaskStore} held in memory, for tests and single-process embedding. One monitor guards all
 * state, which makes insert, claim and compare-and-set atomic.
 */
public class InMemoryTaskStore implements TaskStore {

    private record Stored(TaskEnvelope envelope, long sequence) {
    }

    private final Map<String, Stored> byId = new HashMap<>();
    private long nextSequence;

    @Override
    public synchronized EnqueueResult insertIfAbsent(TaskEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        for (Stored s : byId.values()) {
            TaskEnvelope e = s.envelope();
            if (!e.status().isTerminal()
                    && Objects.equals(e.tenantId(), envelope.tenantId())
                    && e.taskType().equals(envelope.taskType())
                    && Objects.equals(e.idempotencyKey(), envelope.idempotencyKey())) {
                return EnqueueResult.deduplicated(e.id());
            }
        }
        if (byId.containsKey(envelope.id())) {
            throw new IllegalStateException("Duplicate envelope id: " + envelope.id());
        }
        byId.put(envelope.id(), new Stored(envelope, nextSequence++));
        return EnqueueResult.createdResult(envelope.id());
    }

    @Override
    public synchronized Optional<TaskEnvelope> findById(String id) {
        Stored s = byId.get(id);
        return s == null ? Optional.empty() : Optional.of(s.envelope());
    }

    @Override
    public synchronized Optional<TaskEnvelope> claimNext(Collection<String> queues, Instant now, String workerId, Duration lockLifetime) {
        Optional<Stored> next = byId.values().stream()
                .filter(s -> s.envelope().status().isClaimable())
                .filter(s -> queues.contains(s.envelope().queue()))
                .filter(s -> !s.envelope().notBefore().isAfter(now))
                .min(Comparator.<Stored>comparingInt(s -> -s.envelope().priority())
                        .thenComparingLong(Stored::sequence));
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Stored s = next.get();
        TaskEnvelope claimed = s.envelope().claimed(workerId, now.plus(lockLifetime), now);
        byId.put(claimed.id(), new Stored(claimed, s.sequence()));
        return Optional.of(claimed);
    }

    @Override
    public synchronized boolean compareAndSet(TaskEnvelope expected, TaskEnvelope updated) {
        Stored s = byId.get(expected.id());
        if (s == null) {
            return false;
        }
        TaskEnvelope current = s.envelope();
        if (current.status() != expected.status()
                || !Objects.equals(current.lockedBy(), expected.lockedBy())
                || !Objects.equals(current.lockUntil(), expected.lockUntil())) {
            return false;
        }
        TaskEnvelope toStore = current.cancelRequested() && !updated.cancelRequested()
                ? updated.withCancelRequested(updated.updatedAt())
                : updated;
        byId.put(toStore.id(), new Stored(toStore, s.sequence()));
        return true;
    }

    @Override
    public synchronized boolean requestCancel(String id, Instant now) {
        Stored s = byId.get(id);
        if (s == null || s.envelope().status().isTerminal()) {
            return false;
        }
        byId.put(id, new Stored(s.envelope().withCancelRequested(now), s.sequence()));
        return true;
    }

    @Override
    public synchronized List<TaskEnvelope> findExpiredLeases(Instant now, int limit) {
        return byId.values().stream()
                .map(Stored::envelope)
                .filter(e -> e.status() == TaskStatus.IN_PROGRESS)
                .filter(e -> e.lockUntil() != null && !e.lockUntil().isAfter(now))
                .limit(limit)
                .toList();
    }

    public synchronized List<TaskEnvelope> all() {
        return new ArrayList<>(byId.values().stream().map(Stored::envelope).toList());
    }

    public synchronized int size() {
        return byId.size();
    }
}
