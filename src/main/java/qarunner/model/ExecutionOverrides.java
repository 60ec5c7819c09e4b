package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-run overrides. Any component may be {@code null}, meaning "use the
 * configured default".
 *
 * @param environment target environment label recorded on the execution
 * @param engine      browser engine for UI tests
 * @param headless    whether UI tests run without a visible window
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionOverrides(String environment, BrowserEngine engine, Boolean headless) {

    private static final ExecutionOverrides NONE = new ExecutionOverrides(null, null, null);

    public static ExecutionOverrides none() {
        return NONE;
    }

    public static ExecutionOverrides environment(String environment) {
        return new ExecutionOverrides(environment, null, null);
    }

    public BrowserEngine engineOr(BrowserEngine fallback) {
        return engine != null ? engine : fallback;
    }

    public boolean headlessOr(boolean fallback) {
        return headless != null ? headless : fallback;
    }
}
