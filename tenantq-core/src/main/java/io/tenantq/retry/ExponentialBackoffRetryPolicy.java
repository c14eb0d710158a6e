package io.tenantq.retry;

import io.tenantq.config.TaskQueueProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code base * 2^retryCount}, capped at {@code maxDelay}, then spread by +/- {@code jitter}.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
        this(baseDelay, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, double jitter, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1)");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    public static ExponentialBackoffRetryPolicy fromProperties(TaskQueueProperties props) {
        return new ExponentialBackoffRetryPolicy(props.getRetryBaseDelay(), props.getRetryMaxDelay(), props.getRetryJitter());
    }

    @Override
    public Instant nextNotBefore(int retryCount, Instant now) {
        return now.plus(delayFor(retryCount));
    }

    Duration delayFor(int retryCount) {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        // 2^62 overflows long arithmetic below, the cap is reached long before
        int exponent = Math.min(Math.max(retryCount, 0), 30);
        long delay = Math.min(max, base * (1L << exponent));
        if (jitter > 0) {
            long spread = (long) (delay * jitter * (random.getAsDouble() * 2 - 1));
            delay = Math.max(1, delay + spread);
        }
        return Duration.ofMillis(delay);
    }
}
