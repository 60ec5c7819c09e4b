package qarunner.player;

/**
 * Side channel notified when a step succeeded only after its selector was
 * healed, so the definition store can persist the replacement.
 */
@FunctionalInterface
public interface HealingListener {

    void onLocatorHealed(String testId, int stepIndex, String originalLocator, String healedLocator);
}
