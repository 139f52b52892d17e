package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.AuthenticationChainResult;
import warden.core.model.auth.AuthenticationOutcome;
import warden.core.model.auth.AuthenticationSession;
import warden.core.model.auth.ConfigValidationResult;
import warden.core.model.auth.FailureKind;
import warden.core.model.request.InboundRequest;
import warden.core.model.rule.Rule;
import warden.core.model.rule.RuleHandler;
import warden.spi.Authenticator;

@DisplayName("AuthenticatorRegistry")
class AuthenticatorRegistryTest {

    private static final InboundRequest REQUEST = InboundRequest.of("GET", "https://api.example.com/", Map.of());

    private final List<String> invoked = new ArrayList<>();

    private Authenticator authenticator(String id, AuthenticationOutcome outcome, ConfigValidationResult validation) {
        return new Authenticator() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Uni<AuthenticationOutcome> authenticate(
                    InboundRequest request, AuthenticationSession session, byte[] config, Rule rule) {
                invoked.add(id);
                if (outcome.isSuccess()) {
                    session.setSubject(id + "-subject");
                }
                return Uni.createFrom().item(outcome);
            }

            @Override
            public ConfigValidationResult validate(byte[] config) {
                return validation;
            }
        };
    }

    private Authenticator authenticator(String id, AuthenticationOutcome outcome) {
        return authenticator(id, outcome, ConfigValidationResult.valid());
    }

    private static Rule rule(String... handlers) {
        final var list = new ArrayList<RuleHandler>();
        for (final var handler : handlers) {
            list.add(RuleHandler.of(handler, "{}"));
        }
        return new Rule("rule-1", list);
    }

    private static AuthenticationChainResult run(AuthenticatorRegistry registry, Rule rule) {
        return registry.authenticate(REQUEST, rule).await().atMost(Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should skip authenticators that are not responsible")
        void shouldSkipNotResponsible() {
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("cookie", AuthenticationOutcome.notResponsible()),
                    authenticator("oauth2_introspection", AuthenticationOutcome.success())));

            var result = run(registry, rule("cookie", "oauth2_introspection"));

            assertTrue(result.isAuthenticated());
            assertEquals(Optional.of("oauth2_introspection"), result.authenticator());
            assertEquals("oauth2_introspection-subject", result.session().subject());
            assertEquals(List.of("cookie", "oauth2_introspection"), invoked);
        }

        @Test
        @DisplayName("should stop at the first failure")
        void shouldStopAtFirstFailure() {
            var failure = AuthenticationOutcome.failure(FailureKind.FORBIDDEN, "audience mismatch: api");
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("first", failure), authenticator("second", AuthenticationOutcome.success())));

            var result = run(registry, rule("first", "second"));

            assertSame(failure, result.outcome());
            assertFalse(result.isAuthenticated());
            assertEquals(List.of("first"), invoked);
        }

        @Test
        @DisplayName("should follow the rule's order")
        void shouldFollowRuleOrder() {
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("first", AuthenticationOutcome.success()),
                    authenticator("second", AuthenticationOutcome.success())));

            var result = run(registry, rule("second", "first"));

            assertEquals(Optional.of("second"), result.authenticator());
            assertEquals(List.of("second"), invoked);
        }

        @Test
        @DisplayName("should be unauthorized when nobody is responsible")
        void shouldBeUnauthorizedWhenNobodyResponsible() {
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("a", AuthenticationOutcome.notResponsible()),
                    authenticator("b", AuthenticationOutcome.notResponsible())));

            var result = run(registry, rule("a", "b"));

            var failure = assertInstanceOf(AuthenticationOutcome.Failure.class, result.outcome());
            assertEquals(FailureKind.UNAUTHORIZED, failure.kind());
            assertEquals("no authenticator was responsible", failure.detail());
            assertTrue(result.authenticator().isEmpty());
        }

        @Test
        @DisplayName("should report an unknown authenticator as misconfigured")
        void shouldReportUnknownAuthenticator() {
            var registry = new AuthenticatorRegistry(List.of(authenticator("a", AuthenticationOutcome.notResponsible())));

            var result = run(registry, rule("a", "jwt"));

            var failure = assertInstanceOf(AuthenticationOutcome.Failure.class, result.outcome());
            assertEquals(FailureKind.MISCONFIGURED, failure.kind());
            assertTrue(failure.detail().contains("jwt"));
        }

        @Test
        @DisplayName("should report a rule without authenticators as misconfigured")
        void shouldReportEmptyRule() {
            var registry = new AuthenticatorRegistry(List.<Authenticator>of());

            var failure = assertInstanceOf(AuthenticationOutcome.Failure.class, run(registry, rule()).outcome());

            assertEquals(FailureKind.MISCONFIGURED, failure.kind());
        }

        @Test
        @DisplayName("should create a fresh session per request")
        void shouldCreateFreshSession() {
            var registry = new AuthenticatorRegistry(List.of(authenticator("a", AuthenticationOutcome.success())));

            var first = run(registry, rule("a"));
            var second = run(registry, rule("a"));

            assertFalse(first.session() == second.session());
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should reject duplicate identifiers")
        void shouldRejectDuplicates() {
            assertThrows(
                    IllegalStateException.class,
                    () -> new AuthenticatorRegistry(List.of(
                            authenticator("a", AuthenticationOutcome.success()),
                            authenticator("a", AuthenticationOutcome.success()))));
        }

        @Test
        @DisplayName("should look authenticators up by identifier")
        void shouldLookUpById() {
            var registry = new AuthenticatorRegistry(List.of(authenticator("a", AuthenticationOutcome.success())));

            assertTrue(registry.find("a").isPresent());
            assertTrue(registry.find("b").isEmpty());
            assertEquals(Set.of("a"), registry.ids());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should pass when every authenticator accepts its configuration")
        void shouldPassWhenAllValid() {
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("a", AuthenticationOutcome.success()),
                    authenticator("b", AuthenticationOutcome.success())));

            assertTrue(registry.validate(rule("a", "b")).isValid());
        }

        @Test
        @DisplayName("should return the first invalid result")
        void shouldReturnFirstInvalid() {
            var registry = new AuthenticatorRegistry(List.of(
                    authenticator("a", AuthenticationOutcome.success(), ConfigValidationResult.notEnabled("a")),
                    authenticator("b", AuthenticationOutcome.success(), ConfigValidationResult.misconfigured("bad"))));

            var result = assertInstanceOf(ConfigValidationResult.Invalid.class, registry.validate(rule("a", "b")));

            assertEquals(FailureKind.NOT_ENABLED, result.kind());
        }

        @Test
        @DisplayName("should reject unknown authenticators and empty rules")
        void shouldRejectUnknownAndEmpty() {
            var registry = new AuthenticatorRegistry(List.of(authenticator("a", AuthenticationOutcome.success())));

            assertTrue(registry.validate(rule("a", "jwt")).isInvalid());
            assertTrue(registry.validate(rule()).isInvalid());
        }
    }
}
