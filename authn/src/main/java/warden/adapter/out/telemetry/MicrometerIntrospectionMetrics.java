package warden.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import warden.core.port.out.IntrospectionMetrics;

/**
 * Metrics for the introspection authenticator.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code warden.authn.introspection.total} - Authenticator invocations by outcome</li>
 *   <li>{@code warden.authn.introspection.duration} - Invocation latency</li>
 *   <li>{@code warden.authn.introspection.retries} - Retried transport attempts</li>
 *   <li>{@code warden.authn.introspection.token.refreshes} - Client credentials token fetches by result</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerIntrospectionMetrics implements IntrospectionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerIntrospectionMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public void recordIntrospection(String outcome, long durationMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.authn.introspection.total")
                .description("Total introspection authenticator invocations")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();

        Timer.builder("warden.authn.introspection.duration")
                .description("Introspection authenticator latency")
                .tag("outcome", nullSafe(outcome))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordTokenRefresh(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.authn.introspection.token.refreshes")
                .description("Client credentials token requests")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRetry() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.authn.introspection.retries")
                .description("Retried introspection transport attempts")
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
