package warden.core.model.auth;

import java.util.Optional;

/**
 * Result of running the authenticators configured for a rule.
 *
 * @param outcome       the deciding outcome (never {@link AuthenticationOutcome.NotResponsible})
 * @param session       the session created for the request, mutated by the successful authenticator
 * @param authenticator identifier of the authenticator that decided, empty if none did
 */
public record AuthenticationChainResult(
        AuthenticationOutcome outcome, AuthenticationSession session, Optional<String> authenticator) {

    public AuthenticationChainResult {
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        if (session == null) {
            session = new AuthenticationSession();
        }
        if (authenticator == null) {
            authenticator = Optional.empty();
        }
    }

    public boolean isAuthenticated() {
        return outcome.isSuccess();
    }
}
