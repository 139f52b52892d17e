package warden.core.port.out;

/**
 * Port for recording introspection metrics.
 */
public interface IntrospectionMetrics {

    /**
     * Record one authenticator invocation.
     *
     * @param outcome    outcome label (success, not_responsible or a failure kind)
     * @param durationMs time spent, in milliseconds
     */
    void recordIntrospection(String outcome, long durationMs);

    /**
     * Record one client-credentials token fetch.
     */
    void recordTokenRefresh(boolean success);

    /**
     * Record one retried transport attempt.
     */
    void recordRetry();
}
