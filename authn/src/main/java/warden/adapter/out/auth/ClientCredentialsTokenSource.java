package warden.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.core.exception.TransportException;
import warden.core.model.auth.PreAuthorizationConfiguration;
import warden.core.port.out.AccessTokenSource;
import warden.core.port.out.IntrospectionMetrics;

/**
 * Access token source implementing the OAuth 2.0 client credentials grant (RFC 6749 §4.4).
 *
 * <p>Features:
 * <ul>
 *   <li>client_secret_basic authentication</li>
 *   <li>Caching until shortly before {@code expires_in} elapses</li>
 *   <li>Request coalescing: concurrent callers share one in-flight token request</li>
 * </ul>
 *
 * <p>Thread-safety: the cached token is an immutable value behind an atomic reference.
 * No lock is held while the token endpoint is called.
 */
public class ClientCredentialsTokenSource implements AccessTokenSource {

    private static final Logger LOG = Logger.getLogger(ClientCredentialsTokenSource.class);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    private final WebClient webClient;
    private final PreAuthorizationConfiguration config;
    private final Duration requestTimeout;
    private final Duration refreshSkew;
    private final Clock clock;
    private final IntrospectionMetrics metrics;

    private final AtomicReference<CachedToken> current = new AtomicReference<>();
    private final AtomicReference<Uni<String>> inFlightFetch = new AtomicReference<>();

    public ClientCredentialsTokenSource(
            WebClient webClient,
            PreAuthorizationConfiguration config,
            Duration requestTimeout,
            Duration refreshSkew,
            Clock clock,
            IntrospectionMetrics metrics) {
        this.webClient = webClient;
        this.config = config;
        this.requestTimeout = requestTimeout;
        this.refreshSkew = refreshSkew;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<String> token() {
        return Uni.createFrom().deferred(() -> {
            final var cached = current.get();
            if (cached != null && cached.isFreshAt(clock.instant())) {
                return Uni.createFrom().item(cached.accessToken());
            }
            return getOrCreateFetch();
        });
    }

    /**
     * Drop the cached token so the next call fetches a new one.
     */
    public void invalidate() {
        current.set(null);
    }

    /**
     * Get the in-flight fetch or start a new one, so concurrent callers share one request.
     *
     * <p>The cached token is checked again once no fetch is in flight: a fetch that
     * completed after the caller saw a stale token has already stored a fresh one.
     */
    Uni<String> getOrCreateFetch() {
        while (true) {
            final var existing = inFlightFetch.get();
            if (existing != null) {
                return existing;
            }
            final var cached = current.get();
            if (cached != null && cached.isFreshAt(clock.instant())) {
                return Uni.createFrom().item(cached.accessToken());
            }
            final var fetch = createFetch();
            if (inFlightFetch.compareAndSet(null, fetch)) {
                return fetch;
            }
        }
    }

    private Uni<String> createFetch() {
        final var self = new AtomicReference<Uni<String>>();
        final var fetch = requestToken()
                .invoke(current::set)
                .map(CachedToken::accessToken)
                .onTermination()
                .invoke(() -> inFlightFetch.compareAndSet(self.get(), null))
                .memoize()
                .indefinitely();
        self.set(fetch);
        return fetch;
    }

    private Uni<CachedToken> requestToken() {
        LOG.debugf("Requesting client credentials token from %s", config.tokenUrl());

        return webClient
                .postAbs(config.tokenUrl())
                .timeout(requestTimeout.toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .putHeader("Authorization", basicCredentials())
                .sendBuffer(Buffer.buffer(buildFormBody()))
                .map(this::parseTokenResponse)
                .invoke(token -> {
                    metrics.recordTokenRefresh(true);
                    LOG.infov("Obtained client credentials token from {0}, valid until {1}",
                            config.tokenUrl(), token.expiresAt());
                })
                .onFailure()
                .transform(error -> {
                    metrics.recordTokenRefresh(false);
                    LOG.warnf("Client credentials token request to %s failed: %s", config.tokenUrl(), error.getMessage());
                    if (error instanceof TransportException) {
                        return error;
                    }
                    return new TransportException("Token request to %s failed: %s"
                            .formatted(config.tokenUrl(), error.getMessage()), error);
                });
    }

    private String buildFormBody() {
        final var form = new StringBuilder("grant_type=client_credentials");
        if (!config.scope().isEmpty()) {
            form.append("&scope=").append(urlEncode(String.join(" ", config.scope())));
        }
        return form.toString();
    }

    private String basicCredentials() {
        final var credentials = urlEncode(config.clientId()) + ":" + urlEncode(config.clientSecret());
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private CachedToken parseTokenResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new TokenEndpointException("Token endpoint returned status " + response.statusCode());
        }

        final JsonObject json;
        try {
            json = response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            throw new TokenEndpointException("Token endpoint returned a malformed response", e);
        }
        if (json == null) {
            throw new TokenEndpointException("Token endpoint returned an empty response");
        }

        final var accessToken = json.getValue("access_token") instanceof String value ? value : null;
        if (accessToken == null || accessToken.isBlank()) {
            throw new TokenEndpointException("Token endpoint response missing access_token");
        }

        final var expiresIn = json.getValue("expires_in") instanceof Number number && number.longValue() > 0
                ? number.longValue()
                : DEFAULT_EXPIRES_IN_SECONDS;
        return CachedToken.issued(accessToken, clock.instant(), Duration.ofSeconds(expiresIn), refreshSkew);
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private record CachedToken(String accessToken, Instant expiresAt, Instant refreshAt) {

        static CachedToken issued(String accessToken, Instant issuedAt, Duration lifetime, Duration skew) {
            // never refresh earlier than half-way through a short-lived token
            final var refreshAfter = lifetime.minus(skew).compareTo(lifetime.dividedBy(2)) > 0
                    ? lifetime.minus(skew)
                    : lifetime.dividedBy(2);
            return new CachedToken(accessToken, issuedAt.plus(lifetime), issuedAt.plus(refreshAfter));
        }

        boolean isFreshAt(Instant now) {
            return now.isBefore(refreshAt);
        }

        @Override
        public String toString() {
            return "CachedToken[expiresAt=" + expiresAt + "]";
        }
    }

    /**
     * Exception thrown when the token endpoint answers, but not with a usable token.
     */
    public static class TokenEndpointException extends TransportException {
        public TokenEndpointException(String message) {
            super(message);
        }

        public TokenEndpointException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
