package qarunner.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * When a schedule fires. Cron triggers are evaluated in UTC.
 *
 * @param kind     trigger kind
 * @param cron     6-field cron expression ({@link Kind#CRON} only)
 * @param interval fixed period ({@link Kind#INTERVAL} only)
 * @param anchor   first fire of an interval trigger, or the single fire of a one-shot
 */
public record Trigger(Kind kind, String cron, Duration interval, Instant anchor) {

    public enum Kind { CRON, INTERVAL, ONCE }

    public static Trigger cron(String expression) {
        return new Trigger(Kind.CRON, expression, null, null);
    }

    public static Trigger interval(Duration every, Instant anchor) {
        return new Trigger(Kind.INTERVAL, null, every, anchor);
    }

    public static Trigger once(Instant at) {
        return new Trigger(Kind.ONCE, null, null, at);
    }

    public boolean isRecurring() {
        return kind != Kind.ONCE;
    }

    /**
     * First fire time strictly after {@code after}, or {@code null} if the
     * trigger will never fire again.
     */
    public Instant nextFireAfter(Instant after) {
        return switch (kind) {
            case CRON -> {
                ZonedDateTime next = CronExpression.parse(cron).next(ZonedDateTime.ofInstant(after, ZoneOffset.UTC));
                yield next == null ? null : next.toInstant();
            }
            case INTERVAL -> {
                if (anchor.isAfter(after)) yield anchor;
                long periodMs = interval.toMillis();
                long elapsedPeriods = Duration.between(anchor, after).toMillis() / periodMs;
                yield anchor.plusMillis((elapsedPeriods + 1) * periodMs);
            }
            case ONCE -> anchor.isAfter(after) ? anchor : null;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CRON -> "cron[" + cron + "]";
            case INTERVAL -> "every " + interval + " from " + anchor;
            case ONCE -> "once at " + anchor;
        };
    }
}
