package qarunner.session;

import org.testng.annotations.Test;
import qarunner.model.BrowserEngine;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class PoolConfigTest {

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        PoolConfig cfg = new PoolConfig(new Properties());

        assertThat(cfg.getMaxSize()).isEqualTo(5);
        assertThat(cfg.getIdleTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(cfg.getSweepInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(cfg.getDefaultEngine()).isEqualTo(BrowserEngine.CHROMIUM);
        assertThat(cfg.isDefaultHeadless()).isTrue();
    }

    @Test(description = "Engine and sizes are read from properties")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("pool.max.size", "2");
        p.setProperty("pool.idle.timeout.sec", "30");
        p.setProperty("pool.default.engine", "firefox");
        p.setProperty("pool.default.headless", "false");

        PoolConfig cfg = new PoolConfig(p);

        assertThat(cfg.getMaxSize()).isEqualTo(2);
        assertThat(cfg.getIdleTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.getDefaultEngine()).isEqualTo(BrowserEngine.FIREFOX);
        assertThat(cfg.isDefaultHeadless()).isFalse();
    }

    @Test(description = "Unknown engine and a zero size fall back to safe values")
    public void testInvalidValues() {
        Properties p = new Properties();
        p.setProperty("pool.default.engine", "netscape");
        p.setProperty("pool.max.size", "0");
        p.setProperty("pool.sweep.interval.sec", "0");

        PoolConfig cfg = new PoolConfig(p);

        assertThat(cfg.getDefaultEngine()).isEqualTo(BrowserEngine.CHROMIUM);
        assertThat(cfg.getMaxSize()).isEqualTo(1);
        assertThat(cfg.getSweepInterval()).isEqualTo(Duration.ofSeconds(1));
    }
}
