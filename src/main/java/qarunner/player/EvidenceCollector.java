package qarunner.player;

import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.TestStep;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

/**
 * Captures diagnostic artifacts when a step fails.
 *
 * <p>Evidence is written to:
 * <pre>{evidenceBaseDir}/{runKey}/{stepIndex}/</pre>
 * and consists of {@code screenshot.png}, {@code page-source.html} and
 * {@code context.txt}. Every artifact is best-effort: failures are logged
 * and never affect the step result.
 */
public class EvidenceCollector {

    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    private final String evidenceBaseDir;
    private final boolean screenshots;
    private final boolean pageSource;

    public EvidenceCollector(PlayerConfig config) {
        this(config.getEvidenceDir(), config.isScreenshotOnFailure(), config.isPageSourceOnFailure());
    }

    public EvidenceCollector(String evidenceBaseDir, boolean screenshots, boolean pageSource) {
        this.evidenceBaseDir = evidenceBaseDir;
        this.screenshots     = screenshots;
        this.pageSource      = pageSource;
    }

    /**
     * Collects evidence for a failed step.
     *
     * @param runKey    execution / test key used as the sub-directory
     * @param stepIndex declared step index ({@code -1} for the implicit navigation)
     * @return path of the saved screenshot, or {@code null} if none was taken
     */
    public String collect(WebDriver driver, String runKey, int stepIndex, TestStep step, String error) {
        Path dir = buildEvidenceDir(runKey, stepIndex);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.warn("EvidenceCollector: cannot create evidence directory {}: {}", dir, e.getMessage());
            return null;
        }

        String screenshot = screenshots ? captureScreenshot(driver, dir) : null;
        if (pageSource) {
            capturePageSource(driver, dir);
        }
        captureContext(driver, dir, stepIndex, step, error);
        return screenshot;
    }

    // ── Private helpers ──────────────────────────────────────────────────

    private Path buildEvidenceDir(String runKey, int stepIndex) {
        String safeName = (runKey == null ? "adhoc" : runKey).replaceAll("[^a-zA-Z0-9_\\-]", "_");
        String stepDir = stepIndex < 0 ? "navigation" : String.valueOf(stepIndex);
        return Paths.get(evidenceBaseDir, safeName, stepDir);
    }

    private String captureScreenshot(WebDriver driver, Path dir) {
        if (!(driver instanceof TakesScreenshot)) {
            log.debug("EvidenceCollector: driver does not support screenshots");
            return null;
        }
        try {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            Path target = dir.resolve("screenshot.png");
            Files.write(target, png);
            log.info("EvidenceCollector: screenshot saved to {}", target);
            return target.toString();
        } catch (IOException | RuntimeException e) {
            log.warn("EvidenceCollector: failed to capture screenshot: {}", e.getMessage());
            return null;
        }
    }

    private void capturePageSource(WebDriver driver, Path dir) {
        try {
            String source = driver.getPageSource();
            if (source == null) return;
            Files.writeString(dir.resolve("page-source.html"), source, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.warn("EvidenceCollector: failed to capture page source: {}", e.getMessage());
        }
    }

    private void captureContext(WebDriver driver, Path dir, int stepIndex, TestStep step, String error) {
        String url;
        try {
            url = driver.getCurrentUrl();
        } catch (RuntimeException e) {
            url = "(unavailable)";
        }
        List<String> lines = List.of(
                "Captured at : " + Instant.now(),
                "Step index  : " + stepIndex,
                "Action      : " + step.getAction(),
                "Target      : " + step.getTarget(),
                "Current URL : " + url,
                "Error       : " + error);
        try {
            Files.write(dir.resolve("context.txt"), lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("EvidenceCollector: failed to write context.txt: {}", e.getMessage());
        }
    }
}
