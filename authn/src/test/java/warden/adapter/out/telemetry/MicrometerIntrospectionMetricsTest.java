package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("MicrometerIntrospectionMetrics")
@ExtendWith(MockitoExtension.class)
class MicrometerIntrospectionMetricsTest {

    @Mock
    private TelemetryConfig config;

    @Mock
    private TelemetryConfig.MetricsConfig metricsConfig;

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        lenient().when(config.metrics()).thenReturn(metricsConfig);
    }

    @Test
    @DisplayName("should count invocations and latency by outcome")
    void shouldRecordIntrospections() {
        lenient().when(metricsConfig.enabled()).thenReturn(true);
        var metrics = new MicrometerIntrospectionMetrics(registry, config);

        metrics.recordIntrospection("success", 12);
        metrics.recordIntrospection("success", 8);
        metrics.recordIntrospection("forbidden", 5);

        assertEquals(2.0, registry.get("warden.authn.introspection.total").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("warden.authn.introspection.total").tag("outcome", "forbidden").counter().count());
        assertEquals(2, registry.get("warden.authn.introspection.duration").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("should count token refreshes and retries")
    void shouldRecordRefreshesAndRetries() {
        lenient().when(metricsConfig.enabled()).thenReturn(true);
        var metrics = new MicrometerIntrospectionMetrics(registry, config);

        metrics.recordTokenRefresh(true);
        metrics.recordTokenRefresh(false);
        metrics.recordRetry();

        assertEquals(1.0, registry.get("warden.authn.introspection.token.refreshes").tag("success", "false").counter().count());
        assertEquals(1.0, registry.get("warden.authn.introspection.retries").counter().count());
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        lenient().when(metricsConfig.enabled()).thenReturn(false);
        var metrics = new MicrometerIntrospectionMetrics(registry, config);

        metrics.recordIntrospection("success", 1);
        metrics.recordRetry();

        assertNull(registry.find("warden.authn.introspection.total").counter());
        assertTrue(registry.getMeters().isEmpty());
    }
}
