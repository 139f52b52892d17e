package warden.core.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry settings of the pre-authorized introspection transport, as duration strings
 * such as {@code 500ms} or {@code 1s}.
 *
 * @param maxDelay    delay before the first retry; later retries back off from it
 * @param giveUpAfter total time after which no further retry is attempted
 */
public record RetryConfiguration(
        @JsonProperty("max_delay") String maxDelay, @JsonProperty("give_up_after") String giveUpAfter) {

    public static final String DEFAULT_MAX_DELAY = "500ms";
    public static final String DEFAULT_GIVE_UP_AFTER = "1s";

    public static RetryConfiguration defaults() {
        return new RetryConfiguration(DEFAULT_MAX_DELAY, DEFAULT_GIVE_UP_AFTER);
    }

    /**
     * Fill blank fields with their defaults, keeping the configured ones.
     */
    public RetryConfiguration withDefaults() {
        return new RetryConfiguration(
                maxDelay == null || maxDelay.isBlank() ? DEFAULT_MAX_DELAY : maxDelay,
                giveUpAfter == null || giveUpAfter.isBlank() ? DEFAULT_GIVE_UP_AFTER : giveUpAfter);
    }
}
