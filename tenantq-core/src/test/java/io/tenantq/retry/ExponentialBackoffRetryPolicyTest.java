package io.tenantq.retry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffRetryPolicyTest {

    private final ExponentialBackoffRetryPolicy noJitter =
            new ExponentialBackoffRetryPolicy(Duration.ofSeconds(10), Duration.ofSeconds(700), 0);

    @ParameterizedTest
    @CsvSource({
            "1, 20",
            "2, 40",
            "3, 80",
            "6, 640",
            "7, 700",
            "40, 700"
    })
    void doublesUntilTheCap(int retryCount, long expectedSeconds) {
        assertThat(noJitter.delayFor(retryCount)).isEqualTo(Duration.ofSeconds(expectedSeconds));
    }

    @Test
    void nextNotBeforeIsRelativeToNow() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        assertThat(noJitter.nextNotBefore(1, now)).isEqualTo(now.plusSeconds(20));
    }

    @Test
    void jitterStaysWithinTheConfiguredSpread() {
        ExponentialBackoffRetryPolicy low = new ExponentialBackoffRetryPolicy(
                Duration.ofSeconds(10), Duration.ofSeconds(700), 0.1, () -> 0.0);
        ExponentialBackoffRetryPolicy high = new ExponentialBackoffRetryPolicy(
                Duration.ofSeconds(10), Duration.ofSeconds(700), 0.1, () -> 0.999999);

        assertThat(low.delayFor(1)).isEqualTo(Duration.ofSeconds(18));
        assertThat(high.delayFor(1)).isBetween(Duration.ofMillis(21_990), Duration.ofSeconds(22));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(Duration.ZERO, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
