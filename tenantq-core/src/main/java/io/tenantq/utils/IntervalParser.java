package io.tenantq.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * Parses schedule specs and computes fire times.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron expressions, 5 fields ("*&#47;5 * * * *") or 6 fields with seconds ("0 0 2 * * *")</li>
 *   <li>Daily fixed time: "AT 09:00"</li>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours", "30s", or plain seconds</li>
 * </ul>
 * <p>
 * Cron and "AT" specs are calendar based and evaluated in the given zone. Interval specs fire every
 * {@code interval} counted from the previous fire time.
 */
public final class IntervalParser {
    private static final String AT_PREFIX = "AT ";

    private IntervalParser() {
    }

    /**
     * First fire time strictly after {@code after}.
     *
     * @param spec schedule spec in one of the supported formats
     * @param zone zone for cron and "AT" specs; null means UTC
     */
    public static Instant nextFireTime(String spec, ZoneId zone, Instant after) {
        String s = requireSpec(spec);
        Objects.requireNonNull(after, "after must not be null");
        ZoneId z = zone != null ? zone : ZoneId.of("UTC");

        if (s.startsWith(AT_PREFIX)) {
            LocalTime lt = parseTimeOfDay(s);
            ZonedDateTime base = ZonedDateTime.ofInstant(after, z);
            ZonedDateTime candidate = base.with(lt);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1).with(lt);
            }
            return candidate.toInstant();
        }

        if (looksLikeCron(s)) {
            return after.plus(parseCronDuration(normalizeCron(s), z, after));
        }

        Duration interval = parseHumanDuration(s);
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + spec);
        }
        return after.plus(interval);
    }

    /**
     * Fails with {@link IllegalArgumentException} when {@code spec} is not a supported schedule.
     */
    public static void validate(String spec) {
        nextFireTime(spec, ZoneId.of("UTC"), Instant.EPOCH);
    }

    /**
     * Parse a spec into the duration from {@code from} until it next fires.
     */
    public static Duration parseDuration(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        return Duration.between(from, nextFireTime(spec, zone, from));
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron with seconds.
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String spec) {
        String s = requireSpec(spec);
        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    // Quartz wants exactly one of day-of-month / day-of-week to be "?"
    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;
        if ("*".equals(dow) || "?".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }
        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            String[] parts = spec.trim().split("\\s+");
            return (parts.length == 5 || parts.length == 6) && CronExpression.isValidExpression(normalizeCron(spec));
        } catch (RuntimeException ignored) {
            return false;
        }
    }

    /**
     * Compute duration from {@code from} to the next cron occurrence.
     */
    public static Duration parseCronDuration(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(from));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return Duration.between(from, nextDate.toInstant());
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<String> seenUnits = new HashSet<>();
        long totalSeconds = 0;
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }
            if (!seenUnits.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }

            totalSeconds += switch (unit) {
                case "week" -> ChronoUnit.WEEKS.getDuration().toSeconds() * n;
                case "day" -> ChronoUnit.DAYS.getDuration().toSeconds() * n;
                case "hour" -> ChronoUnit.HOURS.getDuration().toSeconds() * n;
                case "minute" -> ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                case "second" -> n;
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            };
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static LocalTime parseTimeOfDay(String spec) {
        String timeOfDay = spec.substring(AT_PREFIX.length()).trim();
        try {
            return LocalTime.parse(timeOfDay);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid time of day in '" + spec + "'", ex);
        }
    }

    private static String requireSpec(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        return s;
    }
}
