package warden.core.model.transport;

import java.time.Duration;

/**
 * Backoff profile of a resilient transport.
 *
 * @param baseDelay delay before the first retry; each further retry doubles it
 * @param maxWait   total time after which no further retry is attempted
 */
public record RetryPolicy(Duration baseDelay, Duration maxWait) {

    /**
     * Fixed profile used when the authenticator does not pre-authorize.
     */
    public static final RetryPolicy LATENCY_TOLERANCE_SMALL = new RetryPolicy(Duration.ofMillis(50), Duration.ofSeconds(1));

    public RetryPolicy {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive, got: " + baseDelay);
        }
        if (maxWait == null || maxWait.isNegative() || maxWait.isZero()) {
            throw new IllegalArgumentException("Max wait must be positive, got: " + maxWait);
        }
    }
}
