package io.tenantq.retry;

import java.time.Instant;

public interface RetryPolicy {

    /**
     * Earliest time the next attempt may be claimed.
     *
     * @param retryCount retry count after the failed attempt was counted (1 for the first retry)
     */
    Instant nextNotBefore(int retryCount, Instant now);
}
