package warden.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.telemetry.metrics.enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
