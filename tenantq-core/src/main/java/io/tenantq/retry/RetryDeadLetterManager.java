package io.tenantq.retry;

import io.tenantq.core.DeadLetterReason;
import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskEvent;
import io.tenantq.core.TaskEventType;
import io.tenantq.core.TaskResult;
import io.tenantq.core.TaskStatus;
import io.tenantq.isolation.IsolationViolationException;
import io.tenantq.spi.ResultStore;
import io.tenantq.spi.TaskEventPublisher;
import io.tenantq.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides what happens to a claimed envelope whose attempt did not complete.
 *
 * <p>Every outcome is first written to the envelope with a compare-and-set against the claimed
 * state; the dead-letter record, result and event follow only when that write won. A lost CAS
 * means another writer (a lease reaper, a cancel) already moved the envelope, and nothing else is
 * written.
 */
public class RetryDeadLetterManager {
    private static final Logger log = LoggerFactory.getLogger(RetryDeadLetterManager.class);

    static final String CANCELLED = "cancelled";

    private final TaskStore taskStore;
    private final ResultStore resultStore;
    private final TaskEventPublisher eventPublisher;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public RetryDeadLetterManager(TaskStore taskStore,
                                  ResultStore resultStore,
                                  TaskEventPublisher eventPublisher,
                                  RetryPolicy retryPolicy,
                                  Clock clock) {
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.resultStore = Objects.requireNonNull(resultStore, "resultStore must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Classifies {@code error} and applies the outcome.
     *
     * @return the stored envelope, empty when the envelope was moved by someone else
     */
    public Optional<TaskEnvelope> classifyAndHandle(TaskEnvelope claimed, Throwable error, FailureClassifier classifier) {
        Throwable cause = DefaultFailureClassifier.unwrap(error);
        if (cause instanceof TaskCancelledException) {
            return cancelled(claimed);
        }
        if (cause instanceof IsolationViolationException violation) {
            DeadLetterReason reason = violation.reason() == IsolationViolationException.Reason.TENANT_INACTIVE
                    ? DeadLetterReason.TENANT_INACTIVE
                    : DeadLetterReason.ISOLATION_VIOLATION;
            return deadLetter(claimed, reason, describe(cause));
        }

        FailureKind kind = classifyQuietly(classifier, cause);
        if (kind == FailureKind.PERMANENT) {
            return deadLetter(claimed, DeadLetterReason.PERMANENT_FAILURE, describe(cause));
        }
        return handleTransient(claimed, describe(cause));
    }

    /**
     * Transient failure: schedule another attempt with backoff, or dead-letter once the retry
     * budget is used up.
     */
    public Optional<TaskEnvelope> handleTransient(TaskEnvelope claimed, String error) {
        Instant now = clock.instant();
        int nextRetryCount = claimed.retryCount() + 1;
        if (nextRetryCount >= claimed.maxRetries()) {
            int finalCount = Math.min(nextRetryCount, claimed.maxRetries());
            return deadLetter(claimed, claimed.deadLettered(finalCount, error, now),
                    DeadLetterReason.RETRIES_EXHAUSTED, error, now);
        }

        Instant notBefore = retryPolicy.nextNotBefore(nextRetryCount, now);
        TaskEnvelope retrying = claimed.retrying(nextRetryCount, notBefore, error, now);
        if (!taskStore.compareAndSet(claimed, retrying)) {
            log.debug("tenantq retry skipped, envelope moved id={}", claimed.id());
            return Optional.empty();
        }
        log.warn("tenantq task failed type={} id={} tenant={} retry={}/{} notBefore={} msg={}",
                claimed.taskType(), claimed.id(), claimed.owner(), nextRetryCount, claimed.maxRetries(), notBefore, error);
        eventPublisher.publish(TaskEvent.of(TaskEventType.FAILED, retrying, error, now));
        return Optional.of(retrying);
    }

    public Optional<TaskEnvelope> deadLetter(TaskEnvelope claimed, DeadLetterReason reason, String error) {
        Instant now = clock.instant();
        return deadLetter(claimed, claimed.deadLettered(claimed.retryCount(), error, now), reason, error, now);
    }

    /**
     * Ends an envelope whose cancellation was observed. The envelope becomes FAILED with error
     * "cancelled".
     */
    public Optional<TaskEnvelope> cancelled(TaskEnvelope current) {
        Instant now = clock.instant();
        TaskEnvelope failed = current.failed(CANCELLED, now);
        if (!taskStore.compareAndSet(current, failed)) {
            return Optional.empty();
        }
        log.info("tenantq task cancelled type={} id={} tenant={}", current.taskType(), current.id(), current.owner());
        resultStore.saveResult(TaskResult.failure(failed, TaskStatus.FAILED, CANCELLED, now));
        eventPublisher.publish(TaskEvent.of(TaskEventType.FAILED, failed, CANCELLED, now));
        return Optional.of(failed);
    }

    private Optional<TaskEnvelope> deadLetter(TaskEnvelope claimed,
                                              TaskEnvelope deadLettered,
                                              DeadLetterReason reason,
                                              String error,
                                              Instant now) {
        if (!taskStore.compareAndSet(claimed, deadLettered)) {
            log.debug("tenantq dead-letter skipped, envelope moved id={}", claimed.id());
            return Optional.empty();
        }
        log.error("tenantq task dead-lettered type={} id={} tenant={} reason={} retries={}/{} msg={}",
                claimed.taskType(), claimed.id(), claimed.owner(), reason.description(),
                deadLettered.retryCount(), deadLettered.maxRetries(), error);
        resultStore.saveDeadLetter(DeadLetterRecord.of(deadLettered, reason, error, now));
        resultStore.saveResult(TaskResult.failure(deadLettered, TaskStatus.DEAD_LETTERED, error, now));
        eventPublisher.publish(TaskEvent.of(TaskEventType.DEAD_LETTERED, deadLettered, reason.description(), now));
        return Optional.of(deadLettered);
    }

    private FailureKind classifyQuietly(FailureClassifier classifier, Throwable cause) {
        FailureClassifier effective = classifier != null ? classifier : DefaultFailureClassifier.INSTANCE;
        try {
            FailureKind kind = effective.classify(cause);
            return kind != null ? kind : FailureKind.TRANSIENT;
        } catch (RuntimeException e) {
            log.warn("tenantq failure classifier threw, treating as transient msg={}", e.getMessage(), e);
            return FailureKind.TRANSIENT;
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }
}
