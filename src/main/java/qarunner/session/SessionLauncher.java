package qarunner.session;

import org.openqa.selenium.WebDriver;
import qarunner.model.BrowserEngine;

/** Starts a new, exclusively owned browser instance. */
public interface SessionLauncher {

    /**
     * @throws SessionLaunchException if the browser cannot be started
     */
    WebDriver launch(BrowserEngine engine, boolean headless);
}
