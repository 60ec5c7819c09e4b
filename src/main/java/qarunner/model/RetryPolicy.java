package qarunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a schedule does when a scheduled run ends {@code FAILED} or {@code ERROR}.
 */
public enum RetryPolicy {
    NONE("none"),
    RETRY_ONCE("retry-once"),
    RETRY_N("retry-n");

    private final String id;

    RetryPolicy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Unknown or missing ids map to {@link #NONE}. */
    @JsonCreator
    public static RetryPolicy fromId(String id) {
        if (id != null) {
            for (RetryPolicy p : values()) {
                if (p.id.equalsIgnoreCase(id.trim())) return p;
            }
        }
        return NONE;
    }

    /**
     * Number of re-runs allowed after the first attempt.
     *
     * @param retryCount the schedule's configured count, used by {@link #RETRY_N}
     */
    public int additionalAttempts(int retryCount) {
        return switch (this) {
            case NONE -> 0;
            case RETRY_ONCE -> 1;
            case RETRY_N -> Math.max(0, retryCount);
        };
    }
}
