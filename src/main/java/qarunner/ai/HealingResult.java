package qarunner.ai;

/**
 * Outcome of one healing attempt.
 *
 * @param healed        {@code true} when a candidate selector was produced
 * @param locator       the candidate selector, or {@code null}
 * @param failureReason why no candidate was produced, or {@code null}
 */
public record HealingResult(boolean healed, String locator, String failureReason) {

    public static HealingResult success(String locator) {
        return new HealingResult(true, locator, null);
    }

    public static HealingResult failed(String reason) {
        return new HealingResult(false, null, reason);
    }
}
