package qarunner.scheduler;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import qarunner.model.Schedule;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RecurrenceTranslatorTest {

    /** A Wednesday. */
    private static final Instant ANCHOR = Instant.parse("2024-05-15T14:30:00Z");

    // ── Calendar frequencies ──────────────────────────────────────────────

    @Test(description = "daily fires at the anchor's time of day")
    public void daily() {
        Trigger t = RecurrenceTranslator.translate("daily", ANCHOR);

        assertThat(t.kind()).isEqualTo(Trigger.Kind.CRON);
        assertThat(t.cron()).isEqualTo("0 30 14 * * *");
        assertThat(t.nextFireAfter(ANCHOR)).isEqualTo(Instant.parse("2024-05-16T14:30:00Z"));
    }

    @Test(description = "weekly fires on the anchor's weekday")
    public void weekly() {
        Trigger t = RecurrenceTranslator.translate("weekly", ANCHOR);

        assertThat(t.cron()).isEqualTo("0 30 14 * * 3");
        assertThat(t.nextFireAfter(ANCHOR)).isEqualTo(Instant.parse("2024-05-22T14:30:00Z"));
    }

    @Test(description = "Sunday maps to cron day 0")
    public void weekly_sunday() {
        Trigger t = RecurrenceTranslator.translate("WEEKLY", Instant.parse("2024-05-19T06:05:00Z"));

        assertThat(t.cron()).isEqualTo("0 5 6 * * 0");
    }

    @Test(description = "monthly fires on the anchor's day of month")
    public void monthly() {
        Trigger t = RecurrenceTranslator.translate("monthly", ANCHOR);

        assertThat(t.cron()).isEqualTo("0 30 14 15 * *");
        assertThat(t.nextFireAfter(ANCHOR)).isEqualTo(Instant.parse("2024-06-15T14:30:00Z"));
    }

    // ── Cron ──────────────────────────────────────────────────────────────

    @Test(description = "five-field cron gains a seconds field")
    public void cron_fiveFields() {
        Trigger t = RecurrenceTranslator.translate("cron: */15 9-17 * * MON-FRI", null);

        assertThat(t.cron()).isEqualTo("0 */15 9-17 * * MON-FRI");
        assertThat(t.nextFireAfter(Instant.parse("2024-05-18T12:00:00Z")))
                .as("Saturday -> Monday 09:00")
                .isEqualTo(Instant.parse("2024-05-20T09:00:00Z"));
    }

    @Test(description = "six-field cron passes through; prefix is case-insensitive")
    public void cron_sixFields() {
        assertThat(RecurrenceTranslator.translate("CRON:30 0 2 * * *", null).cron()).isEqualTo("30 0 2 * * *");
    }

    @DataProvider
    public Object[][] badCron() {
        return new Object[][] { { "cron:" }, { "cron:* * *" }, { "cron:61 * * * *" }, { "cron:0 0 0 0 0 0 0" } };
    }

    @Test(dataProvider = "badCron")
    public void cron_invalid(String frequency) {
        assertThatThrownBy(() -> RecurrenceTranslator.validate(frequency))
                .isInstanceOf(InvalidRecurrenceException.class);
    }

    // ── Intervals ─────────────────────────────────────────────────────────

    @DataProvider
    public Object[][] intervals() {
        return new Object[][] {
                { "every_5_minutes", Duration.ofMinutes(5) },
                { "every_1_minute",  Duration.ofMinutes(1) },
                { "every_2_hours",   Duration.ofHours(2) },
                { "Every_3_Days",    Duration.ofDays(3) },
        };
    }

    @Test(dataProvider = "intervals")
    public void interval(String frequency, Duration expected) {
        Trigger t = RecurrenceTranslator.translate(frequency, ANCHOR);

        assertThat(t.kind()).isEqualTo(Trigger.Kind.INTERVAL);
        assertThat(t.interval()).isEqualTo(expected);
        assertThat(t.anchor()).isEqualTo(ANCHOR);
    }

    @Test(description = "zero and absurd intervals are rejected")
    public void interval_outOfRange() {
        assertThatThrownBy(() -> RecurrenceTranslator.translate("every_0_minutes", ANCHOR))
                .isInstanceOf(InvalidRecurrenceException.class)
                .hasMessageContaining("at least 1");
        assertThatThrownBy(() -> RecurrenceTranslator.translate("every_99999999999999999999_days", ANCHOR))
                .isInstanceOf(InvalidRecurrenceException.class);
        assertThatThrownBy(() -> RecurrenceTranslator.translate("every_9999999999999999_days", ANCHOR))
                .isInstanceOf(InvalidRecurrenceException.class);
    }

    // ── Once and errors ───────────────────────────────────────────────────

    @Test(description = "once fires a single time at nextRunAt")
    public void once() {
        Schedule s = new Schedule("s1", "p", "once", ANCHOR);

        Trigger t = RecurrenceTranslator.translate(s);

        assertThat(t.isRecurring()).isFalse();
        assertThat(t.nextFireAfter(ANCHOR.minusSeconds(1))).isEqualTo(ANCHOR);
        assertThat(t.nextFireAfter(ANCHOR)).isNull();
    }

    @Test(description = "calendar frequencies need nextRunAt")
    public void missingAnchor() {
        assertThatThrownBy(() -> RecurrenceTranslator.translate("daily", null))
                .isInstanceOf(InvalidRecurrenceException.class)
                .hasMessage("Frequency 'daily' requires nextRunAt");
    }

    @Test(description = "unknown and empty frequencies are rejected")
    public void unsupported() {
        assertThatThrownBy(() -> RecurrenceTranslator.validate("fortnightly"))
                .hasMessage("Unsupported frequency: 'fortnightly'");
        assertThatThrownBy(() -> RecurrenceTranslator.validate("  "))
                .hasMessage("Frequency is empty");
    }
}
