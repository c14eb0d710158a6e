package io.tenantq.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void parseHumanDurationShouldWork() {
        Duration duration = IntervalParser.parseDuration("5 minutes", UTC, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Duration.ofMinutes(5), duration);
    }

    @Test
    void parseHumanDurationShouldSupportCombinedAndCompactForms() {
        assertEquals(Duration.ofHours(27), IntervalParser.parseHumanDuration("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(30), IntervalParser.parseHumanDuration("30s"));
        assertEquals(Duration.ofSeconds(90), IntervalParser.parseHumanDuration("90"));
        assertEquals(Duration.ofDays(14), IntervalParser.parseHumanDuration("2 weeks"));
    }

    @Test
    void parseHumanDurationShouldRejectDuplicateUnits() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("1 hour 2 hours"));
    }

    @Test
    void parseCronDurationShouldSupportFiveFieldCron() {
        Duration duration = IntervalParser.parseDuration("*/5 * * * *", UTC, Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Duration.ofMinutes(4), duration);
    }

    @Test
    void nextFireTimeIsStrictlyAfterTheGivenInstant() {
        Instant next = IntervalParser.nextFireTime("*/5 * * * *", UTC, Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void nextFireTimeShouldEvaluateCronInTheEntryZone() {
        Instant next = IntervalParser.nextFireTime("0 9 * * *", ZoneId.of("Europe/Berlin"), Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T08:00:00Z"), next);
    }

    @Test
    void nextFireTimeShouldSupportAtSyntax() {
        Instant next = IntervalParser.nextFireTime("AT 10:00", UTC, Instant.parse("2026-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void nextFireTimeShouldDefaultToUtc() {
        Instant next = IntervalParser.nextFireTime("AT 06:30", null, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T06:30:00Z"), next);
    }

    @Test
    void normalizeCronShouldProduceQuartzSyntax() {
        assertEquals("0 0 2 * * ?", IntervalParser.normalizeCron("0 2 * * *"));
        assertEquals("0 0 9 ? * MON", IntervalParser.normalizeCron("0 9 * * MON"));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(IntervalParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(IntervalParser.looksLikeCron("5 minutes"));
    }

    @Test
    void validateShouldRejectGarbageAndZeroIntervals() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("every now and then"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("0 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("  "));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("AT 25:00"));
    }
}
