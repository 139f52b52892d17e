package warden.adapter.out.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.util.List;

import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.config.IntrospectionConfig;
import warden.core.model.auth.PreAuthorizationConfiguration;
import warden.core.model.transport.RetryPolicy;
import warden.core.port.out.IntrospectionMetrics;

@DisplayName("VertxTransportFactory")
@ExtendWith(MockitoExtension.class)
class VertxTransportFactoryTest {

    private static final RetryPolicy POLICY = new RetryPolicy(Duration.ofMillis(500), Duration.ofSeconds(1));

    @Mock
    private IntrospectionConfig config;

    @Mock
    private IntrospectionMetrics metrics;

    private Vertx vertx;
    private VertxTransportFactory factory;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        lenient().when(config.requestTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.transportCacheSize()).thenReturn(100);
        lenient().when(config.tokenRequestTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.tokenRefreshSkew()).thenReturn(Duration.ofSeconds(10));
        factory = new VertxTransportFactory(vertx, config, metrics);
    }

    @AfterEach
    void tearDown() {
        factory.close();
        vertx.close().await().indefinitely();
    }

    private static PreAuthorizationConfiguration client(String clientId) {
        return new PreAuthorizationConfiguration(
                true, clientId, "secret", List.of("introspect"), "https://auth.example.com/oauth2/token");
    }

    @Test
    @DisplayName("should share one default transport with the small latency profile")
    void shouldShareDefaultTransport() {
        var transport = assertInstanceOf(ResilientTransport.class, factory.defaultTransport());

        assertSame(transport, factory.defaultTransport());
        assertEquals(RetryPolicy.LATENCY_TOLERANCE_SMALL, transport.policy());
    }

    @Test
    @DisplayName("should reuse the transport for an equal configuration")
    void shouldReuseTransportForEqualConfiguration() {
        var first = factory.preAuthorized(client("a"), POLICY);
        var second = factory.preAuthorized(client("a"), new RetryPolicy(Duration.ofMillis(500), Duration.ofSeconds(1)));

        assertSame(first, second);
        assertEquals(POLICY, assertInstanceOf(ResilientTransport.class, first).policy());
    }

    @Test
    @DisplayName("should build separate transports for different credentials or retry policies")
    void shouldSeparateDifferentConfigurations() {
        var a = factory.preAuthorized(client("a"), POLICY);

        assertNotSame(a, factory.preAuthorized(client("b"), POLICY));
        assertNotSame(a, factory.preAuthorized(client("a"), RetryPolicy.LATENCY_TOLERANCE_SMALL));
        assertNotSame(a, factory.defaultTransport());
        assertEquals(3, factory.cachedTransports());
    }
}
