package qarunner.session;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.BrowserEngine;

/**
 * Launches local browsers through Selenium Manager (drivers are resolved
 * automatically). Page-load and script timeouts bound every automation call.
 */
public class SeleniumSessionLauncher implements SessionLauncher {

    private static final Logger log = LoggerFactory.getLogger(SeleniumSessionLauncher.class);

    private final PoolConfig config;

    public SeleniumSessionLauncher(PoolConfig config) {
        this.config = config;
    }

    @Override
    public WebDriver launch(BrowserEngine engine, boolean headless) {
        log.info("Launching {} browser (headless={})", engine.id(), headless);
        WebDriver driver;
        try {
            driver = switch (engine) {
                case CHROMIUM -> {
                    ChromeOptions opts = new ChromeOptions();
                    opts.addArguments("--no-sandbox", "--disable-dev-shm-usage", "--window-size=1920,1080");
                    if (headless) opts.addArguments("--headless=new");
                    yield new ChromeDriver(opts);
                }
                case EDGE -> {
                    EdgeOptions opts = new EdgeOptions();
                    opts.addArguments("--window-size=1920,1080");
                    if (headless) opts.addArguments("--headless=new");
                    yield new EdgeDriver(opts);
                }
                case FIREFOX -> {
                    FirefoxOptions opts = new FirefoxOptions();
                    if (headless) opts.addArguments("-headless");
                    yield new FirefoxDriver(opts);
                }
            };
        } catch (WebDriverException e) {
            throw new SessionLaunchException("Failed to launch " + engine.id() + ": " + e.getMessage(), e);
        }

        try {
            driver.manage().timeouts().pageLoadTimeout(config.getPageLoadTimeout());
            driver.manage().timeouts().scriptTimeout(config.getScriptTimeout());
        } catch (WebDriverException e) {
            log.warn("Could not apply timeouts to {} session: {}", engine.id(), e.getMessage());
        }
        return driver;
    }
}
