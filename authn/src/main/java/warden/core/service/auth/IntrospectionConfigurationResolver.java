package warden.core.service.auth;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.exception.ConfigurationException;
import warden.core.model.auth.BearerTokenLocation;
import warden.core.model.auth.IntrospectionConfiguration;
import warden.core.model.auth.PreAuthorizationConfiguration;
import warden.core.model.auth.RetryConfiguration;
import warden.core.model.auth.ScopeStrategy;
import warden.core.model.transport.RetryPolicy;
import warden.core.port.out.AuthenticatorConfigDecoder;
import warden.core.port.out.IntrospectionTransport;
import warden.core.port.out.IntrospectionTransportFactory;
import warden.core.util.DurationParser;

/**
 * Turns raw per-rule configuration of the introspection authenticator into validated,
 * immutable settings and picks the transport those settings call for.
 *
 * <p>Nothing here mutates shared state: pre-authorized transports come from the
 * {@link IntrospectionTransportFactory}, which caches them by value of their configuration.
 */
@ApplicationScoped
public class IntrospectionConfigurationResolver {

    private static final Logger LOG = Logger.getLogger(IntrospectionConfigurationResolver.class);

    private final AuthenticatorConfigDecoder decoder;
    private final IntrospectionTransportFactory transports;

    @Inject
    public IntrospectionConfigurationResolver(
            AuthenticatorConfigDecoder decoder, IntrospectionTransportFactory transports) {
        this.decoder = decoder;
        this.transports = transports;
    }

    /**
     * Decode and validate a raw configuration.
     *
     * @param rawConfig raw JSON configuration of the rule
     * @return the resolved settings
     * @throws ConfigurationException if the configuration is malformed or invalid
     */
    public ResolvedIntrospection resolve(byte[] rawConfig) {
        final var configuration = decoder.decode(
                OAuth2IntrospectionAuthenticator.ID, rawConfig, IntrospectionConfiguration.class);

        requireHttpUrl("introspection_url", configuration.introspectionUrl());
        final var location = resolveTokenLocation(configuration.tokenFrom());
        final var strategy = resolveScopeStrategy(configuration.scopeStrategy());

        if (!configuration.isPreAuthorizationEnabled()) {
            return new ResolvedIntrospection(configuration, strategy, location, RetryPolicy.LATENCY_TOLERANCE_SMALL);
        }

        validatePreAuthorization(configuration.preAuthorization());
        final var retry = configuration.retry() == null
                ? RetryConfiguration.defaults()
                : configuration.retry().withDefaults();
        final var policy = new RetryPolicy(
                parsePositive("retry.max_delay", retry.maxDelay()),
                parsePositive("retry.give_up_after", retry.giveUpAfter()));

        return new ResolvedIntrospection(configuration.withRetry(retry), strategy, location, policy);
    }

    /**
     * Transport to send the introspection request through.
     */
    public IntrospectionTransport transportFor(ResolvedIntrospection resolved) {
        if (!resolved.configuration().isPreAuthorizationEnabled()) {
            return transports.defaultTransport();
        }
        return transports.preAuthorized(resolved.configuration().preAuthorization(), resolved.retryPolicy());
    }

    private static BearerTokenLocation resolveTokenLocation(BearerTokenLocation tokenFrom) {
        if (tokenFrom == null) {
            return BearerTokenLocation.defaultLocation();
        }
        if (tokenFrom.configuredLocations() != 1) {
            throw new ConfigurationException(
                    "token_from must set exactly one of header, query_parameter or cookie");
        }
        final var name = tokenFrom.header() != null
                ? tokenFrom.header()
                : tokenFrom.queryParameter() != null ? tokenFrom.queryParameter() : tokenFrom.cookie();
        if (name.isBlank()) {
            throw new ConfigurationException("token_from location name must not be empty");
        }
        return tokenFrom;
    }

    private static ScopeStrategy resolveScopeStrategy(String name) {
        try {
            return ScopeStrategy.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static void validatePreAuthorization(PreAuthorizationConfiguration preAuthorization) {
        if (isBlank(preAuthorization.clientId())) {
            throw new ConfigurationException("pre_authorization.client_id is required when pre_authorization is enabled");
        }
        if (isBlank(preAuthorization.clientSecret())) {
            throw new ConfigurationException(
                    "pre_authorization.client_secret is required when pre_authorization is enabled");
        }
        requireHttpUrl("pre_authorization.token_url", preAuthorization.tokenUrl());
    }

    private static Duration parsePositive(String field, String value) {
        final Duration duration;
        try {
            duration = DurationParser.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("%s is not a valid duration: '%s'".formatted(field, value), e);
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new ConfigurationException("%s must be positive, got '%s'".formatted(field, value));
        }
        return duration;
    }

    private static void requireHttpUrl(String field, String value) {
        if (isBlank(value)) {
            throw new ConfigurationException(field + " is required");
        }
        try {
            final var uri = new URI(value);
            final var scheme = uri.getScheme();
            if (!uri.isAbsolute()
                    || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException("%s must be an absolute http or https URL: %s".formatted(field, value));
            }
        } catch (URISyntaxException e) {
            LOG.debugf("Rejected %s: %s", field, e.getMessage());
            throw new ConfigurationException("%s is not a valid URL: %s".formatted(field, value), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Validated settings of one introspection call.
     *
     * @param configuration the decoded configuration, retry defaults applied
     * @param scopeStrategy the resolved scope strategy
     * @param tokenLocation where the bearer token is read from
     * @param retryPolicy   backoff profile of the transport
     */
    public record ResolvedIntrospection(
            IntrospectionConfiguration configuration,
            ScopeStrategy scopeStrategy,
            BearerTokenLocation tokenLocation,
            RetryPolicy retryPolicy) {}
}
