package io.tenantq.spi;

import io.tenantq.core.EnqueueResult;
import io.tenantq.core.TaskEnvelope;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Envelope persistence shared by all workers.
 *
 * <p>Implementations must make {@link #insertIfAbsent}, {@link #claimNext} and
 * {@link #compareAndSet} atomic; the at-most-one-in-flight guarantee rests on them.
 */
public interface TaskStore {

    /**
     * Stores {@code envelope} unless an open (non-terminal) envelope with the same
     * {@code (tenantId, taskType, idempotencyKey)} exists, in which case that envelope's id is
     * returned and nothing is written.
     */
    EnqueueResult insertIfAbsent(TaskEnvelope envelope);

    Optional<TaskEnvelope> findById(String id);

    /**
     * Atomically claims the eligible envelope with the highest priority (oldest first on ties)
     * from {@code queues}: status PENDING or RETRYING and {@code notBefore <= now}. The cancel flag
     * is not a filter; the caller finishes a flagged envelope without running it. The returned
     * envelope is IN_PROGRESS, locked by {@code workerId} until {@code now + lockLifetime}.
     */
    Optional<TaskEnvelope> claimNext(Collection<String> queues, Instant now, String workerId, Duration lockLifetime);

    /**
     * Replaces the stored state with {@code updated} only if the stored envelope still has
     * {@code expected.status()}, {@code expected.lockedBy()} and {@code expected.lockUntil()}.
     * The lease deadline identifies one claim: a worker whose lease was reaped and re-claimed under
     * the same worker id no longer matches. A cancel flag already set in the store is preserved.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(TaskEnvelope expected, TaskEnvelope updated);

    /**
     * Sets the cancel flag on an open envelope.
     *
     * @return false when the envelope is missing or already terminal
     */
    boolean requestCancel(String id, Instant now);

    /**
     * IN_PROGRESS envelopes whose lease ended at or before {@code now}.
     */
    List<TaskEnvelope> findExpiredLeases(Instant now, int limit);
}
