package warden.core.service.auth;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.exception.AuthenticatorException;
import warden.core.exception.ConfigurationException;
import warden.core.exception.IntrospectionException;
import warden.core.model.auth.AuthenticationOutcome;
import warden.core.model.auth.AuthenticationSession;
import warden.core.model.auth.ConfigValidationResult;
import warden.core.model.auth.FailureKind;
import warden.core.model.auth.IntrospectionResult;
import warden.core.model.request.InboundRequest;
import warden.core.model.rule.Rule;
import warden.core.model.transport.TransportRequest;
import warden.core.model.transport.TransportResponse;
import warden.core.port.out.AuthenticatorConfigDecoder;
import warden.core.port.out.IntrospectionMetrics;
import warden.core.service.auth.IntrospectionConfigurationResolver.ResolvedIntrospection;
import warden.core.util.TokenFingerprint;
import warden.spi.Authenticator;

/**
 * Authenticator validating opaque bearer tokens against an OAuth2 token introspection
 * endpoint (RFC 7662).
 *
 * <p>Checks run in a fixed order and stop at the first failure: token type, active flag,
 * audience, issuer, then scope. The configuration is resolved afresh on every call; the
 * instance itself holds no per-request state and is safe for concurrent use.
 */
@ApplicationScoped
public class OAuth2IntrospectionAuthenticator implements Authenticator {

    public static final String ID = "oauth2_introspection";

    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private static final Logger LOG = Logger.getLogger(OAuth2IntrospectionAuthenticator.class);

    private static final ObjectMapper RESPONSE_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final IntrospectionConfigurationResolver resolver;
    private final AuthenticatorConfigDecoder decoder;
    private final IntrospectionMetrics metrics;

    @Inject
    public OAuth2IntrospectionAuthenticator(
            IntrospectionConfigurationResolver resolver,
            AuthenticatorConfigDecoder decoder,
            IntrospectionMetrics metrics) {
        this.resolver = resolver;
        this.decoder = decoder;
        this.metrics = metrics;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Uni<AuthenticationOutcome> authenticate(
            InboundRequest request, AuthenticationSession session, byte[] config, Rule rule) {
        final var startTime = System.nanoTime();
        return Uni.createFrom()
                .deferred(() -> introspect(request, session, config, rule))
                .onFailure()
                .recoverWithItem(error -> toFailure(error, rule))
                .invoke(outcome -> metrics.recordIntrospection(
                        outcome.label(), (System.nanoTime() - startTime) / 1_000_000));
    }

    @Override
    public ConfigValidationResult validate(byte[] config) {
        if (!decoder.isEnabled(ID)) {
            return ConfigValidationResult.notEnabled(ID);
        }
        try {
            resolver.resolve(config);
            return ConfigValidationResult.valid();
        } catch (ConfigurationException e) {
            LOG.warnf("Rejected %s configuration: %s", ID, e.getMessage());
            return ConfigValidationResult.misconfigured(e.getMessage());
        }
    }

    private Uni<AuthenticationOutcome> introspect(
            InboundRequest request, AuthenticationSession session, byte[] config, Rule rule) {
        final var resolved = resolver.resolve(config);

        final var token = BearerTokenExtractor.extract(request, resolved.tokenLocation());
        if (token.isEmpty()) {
            LOG.debugf("No bearer token at %s for rule %s", resolved.tokenLocation(), rule.id());
            return Uni.createFrom().item(AuthenticationOutcome.notResponsible());
        }

        final var fingerprint = TokenFingerprint.of(token.get());
        LOG.debugf("Introspecting token %s for rule %s", fingerprint, rule.id());

        return resolver.transportFor(resolved)
                .send(buildRequest(resolved, token.get()))
                .map(this::decode)
                .map(result -> evaluate(resolved, result, session, fingerprint));
    }

    private TransportRequest buildRequest(ResolvedIntrospection resolved, String token) {
        final var configuration = resolved.configuration();

        final var form = new StringBuilder("token=").append(encode(token));
        if (!resolved.scopeStrategy().checksClientSide()) {
            form.append("&scope=").append(encode(String.join(" ", configuration.requiredScope())));
        }

        final var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(configuration.introspectionRequestHeaders());
        headers.put("Content-Type", FORM_CONTENT_TYPE);

        return new TransportRequest(
                "POST",
                URI.create(configuration.introspectionUrl()),
                headers,
                form.toString().getBytes(StandardCharsets.UTF_8));
    }

    private IntrospectionResult decode(TransportResponse response) {
        if (response.statusCode() != 200) {
            throw new IntrospectionException(
                    FailureKind.TRANSPORT, "unexpected status %d".formatted(response.statusCode()));
        }
        final IntrospectionResult result;
        try {
            result = RESPONSE_MAPPER.readValue(response.body(), IntrospectionResult.class);
        } catch (IOException e) {
            throw new IntrospectionException(
                    FailureKind.DECODE, "malformed introspection response: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new IntrospectionException(FailureKind.DECODE, "empty introspection response");
        }
        return result;
    }

    private AuthenticationOutcome evaluate(
            ResolvedIntrospection resolved,
            IntrospectionResult result,
            AuthenticationSession session,
            String fingerprint) {
        final var configuration = resolved.configuration();

        if (result.hasTokenType() && !result.isAccessToken()) {
            return reject(FailureKind.FORBIDDEN, "not an access token", fingerprint);
        }

        if (!result.active()) {
            return reject(FailureKind.UNAUTHORIZED, "token not active", fingerprint);
        }

        for (final var audience : configuration.targetAudience()) {
            if (!result.audience().contains(audience)) {
                return reject(FailureKind.FORBIDDEN, "audience mismatch: %s".formatted(audience), fingerprint);
            }
        }

        if (!configuration.trustedIssuers().isEmpty() && !configuration.trustedIssuers().contains(result.issuer())) {
            return reject(FailureKind.FORBIDDEN, "issuer mismatch: %s".formatted(result.issuer()), fingerprint);
        }

        final var strategy = resolved.scopeStrategy();
        if (strategy.checksClientSide()) {
            final var granted = result.grantedScopes();
            for (final var scope : configuration.requiredScope()) {
                if (!strategy.isGranted(granted, scope)) {
                    return reject(FailureKind.FORBIDDEN, "scope not granted: %s".formatted(scope), fingerprint);
                }
            }
        }

        session.setSubject(result.subject());
        session.setExtra(result.sessionClaims());
        LOG.debugf("Token %s accepted for subject %s", fingerprint, result.subject());
        return AuthenticationOutcome.success();
    }

    private static AuthenticationOutcome reject(FailureKind kind, String detail, String fingerprint) {
        LOG.debugf("Token %s rejected: %s", fingerprint, detail);
        return AuthenticationOutcome.failure(kind, detail);
    }

    private static AuthenticationOutcome toFailure(Throwable error, Rule rule) {
        if (error instanceof AuthenticatorException authError) {
            LOG.warnf("Introspection for rule %s failed (%s): %s", rule.id(), authError.kind().label(), error.getMessage());
            return AuthenticationOutcome.failure(authError.kind(), error.getMessage(), error);
        }
        LOG.errorv(error, "Unexpected introspection failure for rule {0}", rule.id());
        return AuthenticationOutcome.failure(FailureKind.TRANSPORT, "introspection failed: " + error.getMessage(), error);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
