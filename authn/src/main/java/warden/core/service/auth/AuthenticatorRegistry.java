package warden.core.service.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthenticationChainResult;
import warden.core.model.auth.AuthenticationOutcome;
import warden.core.model.auth.AuthenticationSession;
import warden.core.model.auth.ConfigValidationResult;
import warden.core.model.auth.FailureKind;
import warden.core.model.request.InboundRequest;
import warden.core.model.rule.Rule;
import warden.core.model.rule.RuleHandler;
import warden.spi.Authenticator;

/**
 * Registry of authenticators and dispatcher of the authentication stage.
 *
 * <p>Authenticators are discovered via CDI and looked up by {@link Authenticator#id()}.
 * For a matched rule a fresh session is created and the rule's authenticators are tried
 * in order:
 * <ol>
 *   <li>{@code NotResponsible} moves on to the next authenticator</li>
 *   <li>{@code Success} or {@code Failure} ends the chain</li>
 *   <li>If no authenticator was responsible the request is unauthorized</li>
 * </ol>
 */
@ApplicationScoped
public class AuthenticatorRegistry {

    private static final Logger LOG = Logger.getLogger(AuthenticatorRegistry.class);

    private final Map<String, Authenticator> authenticators;

    @Inject
    public AuthenticatorRegistry(Instance<Authenticator> authenticatorInstances) {
        this((Iterable<Authenticator>) authenticatorInstances);
    }

    public AuthenticatorRegistry(Iterable<? extends Authenticator> authenticatorInstances) {
        final var byId = new LinkedHashMap<String, Authenticator>();
        for (final var authenticator : authenticatorInstances) {
            final var existing = byId.putIfAbsent(authenticator.id(), authenticator);
            if (existing != null) {
                throw new IllegalStateException("Duplicate authenticator id: " + authenticator.id());
            }
        }
        this.authenticators = Collections.unmodifiableMap(byId);
        LOG.infov("AuthenticatorRegistry initialized with authenticators {0}", byId.keySet());
    }

    /**
     * Look up an authenticator by identifier.
     */
    public Optional<Authenticator> find(String id) {
        return Optional.ofNullable(authenticators.get(id));
    }

    public Set<String> ids() {
        return authenticators.keySet();
    }

    /**
     * Run the authenticators of a rule against a request.
     *
     * @param request the inbound request
     * @param rule    the matched rule
     * @return the deciding outcome with the session it produced
     */
    public Uni<AuthenticationChainResult> authenticate(InboundRequest request, Rule rule) {
        final var session = new AuthenticationSession();
        if (rule.authenticators().isEmpty()) {
            return Uni.createFrom().item(new AuthenticationChainResult(
                    AuthenticationOutcome.failure(
                            FailureKind.MISCONFIGURED, "rule %s has no authenticators".formatted(rule.id())),
                    session,
                    Optional.empty()));
        }
        return dispatch(request, session, rule, 0);
    }

    /**
     * Validate every authenticator configuration of a rule, stopping at the first invalid one.
     */
    public ConfigValidationResult validate(Rule rule) {
        if (rule.authenticators().isEmpty()) {
            return ConfigValidationResult.misconfigured("rule %s has no authenticators".formatted(rule.id()));
        }
        for (final var handler : rule.authenticators()) {
            final var authenticator = authenticators.get(handler.handler());
            if (authenticator == null) {
                return ConfigValidationResult.misconfigured(unknownAuthenticator(handler));
            }
            final var result = authenticator.validate(handler.config());
            if (result.isInvalid()) {
                LOG.warnf("Rule %s: authenticator %s is invalid: %s", rule.id(), handler.handler(), result);
                return result;
            }
        }
        return ConfigValidationResult.valid();
    }

    private Uni<AuthenticationChainResult> dispatch(
            InboundRequest request, AuthenticationSession session, Rule rule, int index) {
        if (index >= rule.authenticators().size()) {
            LOG.debugf("Rule %s: no authenticator was responsible", rule.id());
            return Uni.createFrom().item(new AuthenticationChainResult(
                    AuthenticationOutcome.failure(FailureKind.UNAUTHORIZED, "no authenticator was responsible"),
                    session,
                    Optional.empty()));
        }

        final var handler = rule.authenticators().get(index);
        final var authenticator = authenticators.get(handler.handler());
        if (authenticator == null) {
            LOG.warnf("Rule %s references unknown authenticator %s", rule.id(), handler.handler());
            return Uni.createFrom().item(new AuthenticationChainResult(
                    AuthenticationOutcome.failure(FailureKind.MISCONFIGURED, unknownAuthenticator(handler)),
                    session,
                    Optional.of(handler.handler())));
        }

        return Uni.createFrom()
                .deferred(() -> authenticator.authenticate(request, session, handler.config(), rule))
                .flatMap(outcome -> {
                    if (outcome.isNotResponsible()) {
                        LOG.debugf("Rule %s: %s not responsible, trying next", rule.id(), authenticator.id());
                        return dispatch(request, session, rule, index + 1);
                    }
                    LOG.debugf("Rule %s: %s decided %s", rule.id(), authenticator.id(), outcome.label());
                    return Uni.createFrom()
                            .item(new AuthenticationChainResult(outcome, session, Optional.of(authenticator.id())));
                });
    }

    private static String unknownAuthenticator(RuleHandler handler) {
        return "unknown authenticator '%s'".formatted(handler.handler());
    }
}
