package qarunner.scheduler;

import org.testng.annotations.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class TriggerTest {

    private static final Instant ANCHOR = Instant.parse("2024-05-15T10:00:00Z");

    @Test(description = "before the anchor the anchor itself is next")
    public void interval_beforeAnchor() {
        Trigger t = Trigger.interval(Duration.ofMinutes(15), ANCHOR);

        assertThat(t.nextFireAfter(ANCHOR.minusSeconds(3600))).isEqualTo(ANCHOR);
    }

    @Test(description = "fires stay aligned to the anchor grid")
    public void interval_alignedToAnchor() {
        Trigger t = Trigger.interval(Duration.ofMinutes(15), ANCHOR);

        assertThat(t.nextFireAfter(ANCHOR)).isEqualTo(Instant.parse("2024-05-15T10:15:00Z"));
        assertThat(t.nextFireAfter(Instant.parse("2024-05-15T10:44:59Z")))
                .isEqualTo(Instant.parse("2024-05-15T10:45:00Z"));
        assertThat(t.nextFireAfter(Instant.parse("2024-05-15T10:45:00Z")))
                .isEqualTo(Instant.parse("2024-05-15T11:00:00Z"));
    }

    @Test(description = "cron is evaluated in UTC")
    public void cron_utc() {
        Trigger t = Trigger.cron("0 0 2 * * *");

        assertThat(t.nextFireAfter(Instant.parse("2024-05-15T01:59:59Z")))
                .isEqualTo(Instant.parse("2024-05-15T02:00:00Z"));
        assertThat(t.isRecurring()).isTrue();
    }

    @Test
    public void toString_describesKind() {
        assertThat(Trigger.cron("0 0 2 * * *")).hasToString("cron[0 0 2 * * *]");
        assertThat(Trigger.once(ANCHOR)).hasToString("once at 2024-05-15T10:00:00Z");
    }
}
