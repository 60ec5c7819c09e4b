package qarunner.scheduler;

import org.springframework.scheduling.support.CronExpression;
import qarunner.model.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a schedule's frequency string into a {@link Trigger}.
 *
 * <table>
 *   <tr><th>Frequency</th><th>Trigger (UTC)</th></tr>
 *   <tr><td>{@code daily}</td><td>cron {@code 0 m h * * *}</td></tr>
 *   <tr><td>{@code weekly}</td><td>cron {@code 0 m h * * dow}</td></tr>
 *   <tr><td>{@code monthly}</td><td>cron {@code 0 m h dom * *}</td></tr>
 *   <tr><td>{@code cron:<expr>}</td><td>the expression; 5 fields get a leading seconds field</td></tr>
 *   <tr><td>{@code every_N_minutes|hours|days}</td><td>fixed interval anchored at {@code nextRunAt}</td></tr>
 *   <tr><td>{@code once}</td><td>one-shot at {@code nextRunAt}</td></tr>
 * </table>
 *
 * Time-of-day, weekday and day-of-month come from {@code nextRunAt}.
 */
public final class RecurrenceTranslator {

    private static final String CRON_PREFIX = "cron:";
    private static final Pattern EVERY = Pattern.compile("every_(\\d+)_(minute|hour|day)s?");

    private RecurrenceTranslator() {}

    /**
     * @throws InvalidRecurrenceException for an unknown frequency, a malformed
     *         cron expression, an interval below 1, or a missing {@code nextRunAt}
     */
    public static Trigger translate(Schedule schedule) {
        return translate(schedule.getFrequency(), schedule.getNextRunAt());
    }

    /** Checks a frequency string without needing a real anchor. */
    public static void validate(String frequency) {
        translate(frequency, Instant.EPOCH);
    }

    static Trigger translate(String frequency, Instant nextRunAt) {
        if (frequency == null || frequency.isBlank()) {
            throw new InvalidRecurrenceException("Frequency is empty");
        }
        String raw = frequency.trim();
        if (raw.regionMatches(true, 0, CRON_PREFIX, 0, CRON_PREFIX.length())) {
            return Trigger.cron(normalizeCron(raw.substring(CRON_PREFIX.length()).trim()));
        }

        String f = raw.toLowerCase(Locale.ROOT);
        Matcher every = EVERY.matcher(f);
        if (every.matches()) {
            return Trigger.interval(interval(every.group(1), every.group(2), raw), requireAnchor(raw, nextRunAt));
        }

        return switch (f) {
            case Schedule.FREQUENCY_ONCE -> Trigger.once(requireAnchor(raw, nextRunAt));
            case "daily" -> {
                ZonedDateTime t = utc(raw, nextRunAt);
                yield Trigger.cron(String.format("0 %d %d * * *", t.getMinute(), t.getHour()));
            }
            case "weekly" -> {
                ZonedDateTime t = utc(raw, nextRunAt);
                int dow = t.getDayOfWeek().getValue() % 7;
                yield Trigger.cron(String.format("0 %d %d * * %d", t.getMinute(), t.getHour(), dow));
            }
            case "monthly" -> {
                ZonedDateTime t = utc(raw, nextRunAt);
                yield Trigger.cron(String.format("0 %d %d %d * *", t.getMinute(), t.getHour(), t.getDayOfMonth()));
            }
            default -> throw new InvalidRecurrenceException("Unsupported frequency: '" + raw + "'");
        };
    }

    /**
     * Accepts 5-field (Unix) and 6-field (with seconds) expressions and
     * returns the validated 6-field form.
     */
    static String normalizeCron(String expression) {
        String[] fields = expression.trim().split("\\s+");
        String sixField = switch (fields.length) {
            case 5 -> "0 " + String.join(" ", fields);
            case 6 -> String.join(" ", fields);
            default -> throw new InvalidRecurrenceException(
                    "Cron expression must have 5 or 6 fields: '" + expression + "'");
        };
        try {
            CronExpression.parse(sixField);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecurrenceException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
        return sixField;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private static Duration interval(String count, String unit, String raw) {
        long n;
        try {
            n = Long.parseLong(count);
        } catch (NumberFormatException e) {
            throw new InvalidRecurrenceException("Interval out of range in '" + raw + "'", e);
        }
        if (n < 1) {
            throw new InvalidRecurrenceException("Interval must be at least 1 in '" + raw + "'");
        }
        try {
            Duration d = switch (unit) {
                case "minute" -> Duration.ofMinutes(n);
                case "hour" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            };
            d.toMillis();
            return d;
        } catch (ArithmeticException e) {
            throw new InvalidRecurrenceException("Interval out of range in '" + raw + "'", e);
        }
    }

    private static Instant requireAnchor(String frequency, Instant nextRunAt) {
        if (nextRunAt == null) {
            throw new InvalidRecurrenceException("Frequency '" + frequency + "' requires nextRunAt");
        }
        return nextRunAt;
    }

    private static ZonedDateTime utc(String frequency, Instant nextRunAt) {
        return ZonedDateTime.ofInstant(requireAnchor(frequency, nextRunAt), ZoneOffset.UTC);
    }
}
