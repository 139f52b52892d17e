package warden.adapter.out.http;

import java.time.Clock;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.adapter.out.auth.ClientCredentialsTokenSource;
import warden.core.config.IntrospectionConfig;
import warden.core.model.auth.PreAuthorizationConfiguration;
import warden.core.model.transport.RetryPolicy;
import warden.core.port.out.IntrospectionMetrics;
import warden.core.port.out.IntrospectionTransport;
import warden.core.port.out.IntrospectionTransportFactory;

/**
 * Builds the introspection transports on one shared Vert.x HTTP client.
 *
 * <p>Pre-authorized transports are cached in a bounded Caffeine cache keyed by value of the
 * client-credentials and retry configuration, so rules sharing a configuration share one
 * token. Transports are immutable once built.
 */
@ApplicationScoped
public class VertxTransportFactory implements IntrospectionTransportFactory {

    private static final Logger LOG = Logger.getLogger(VertxTransportFactory.class);

    private final HttpClient httpClient;
    private final WebClient webClient;
    private final IntrospectionConfig config;
    private final IntrospectionMetrics metrics;
    private final Clock clock;
    private final IntrospectionTransport defaultTransport;
    private final Cache<TransportKey, IntrospectionTransport> preAuthorizedTransports;

    @Inject
    public VertxTransportFactory(Vertx vertx, IntrospectionConfig config, IntrospectionMetrics metrics) {
        this(vertx, config, metrics, Clock.systemUTC());
    }

    VertxTransportFactory(Vertx vertx, IntrospectionConfig config, IntrospectionMetrics metrics, Clock clock) {
        this.httpClient = vertx.createHttpClient(new HttpClientOptions());
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultTransport = new ResilientTransport(
                new VertxIntrospectionTransport(httpClient, config.requestTimeout()),
                RetryPolicy.LATENCY_TOLERANCE_SMALL,
                metrics);
        this.preAuthorizedTransports = Caffeine.newBuilder()
                .maximumSize(config.transportCacheSize())
                .build();
    }

    @Override
    public IntrospectionTransport defaultTransport() {
        return defaultTransport;
    }

    @Override
    public IntrospectionTransport preAuthorized(
            PreAuthorizationConfiguration preAuthorization, RetryPolicy retryPolicy) {
        return preAuthorizedTransports.get(new TransportKey(preAuthorization, retryPolicy), this::createPreAuthorized);
    }

    long cachedTransports() {
        preAuthorizedTransports.cleanUp();
        return preAuthorizedTransports.estimatedSize();
    }

    private IntrospectionTransport createPreAuthorized(TransportKey key) {
        LOG.infov(
                "Creating pre-authorized transport for client {0} at {1} (retry {2})",
                key.preAuthorization().clientId(), key.preAuthorization().tokenUrl(), key.retryPolicy());
        final var tokenSource = new ClientCredentialsTokenSource(
                webClient,
                key.preAuthorization(),
                config.tokenRequestTimeout(),
                config.tokenRefreshSkew(),
                clock,
                metrics);
        return new ResilientTransport(
                new PreAuthorizedTransport(
                        new VertxIntrospectionTransport(httpClient, config.requestTimeout()), tokenSource),
                key.retryPolicy(),
                metrics);
    }

    @PreDestroy
    public void close() {
        preAuthorizedTransports.invalidateAll();
        webClient.close();
        httpClient.closeAndForget();
    }

    private record TransportKey(PreAuthorizationConfiguration preAuthorization, RetryPolicy retryPolicy) {}
}
