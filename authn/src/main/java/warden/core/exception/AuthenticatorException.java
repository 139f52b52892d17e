package warden.core.exception;

import warden.core.model.auth.FailureKind;

/**
 * Base exception raised inside an authenticator.
 *
 * <p>Authenticators convert these into {@code AuthenticationOutcome.Failure} values
 * of the carried kind before returning to the dispatcher.
 */
public abstract class AuthenticatorException extends RuntimeException {

    private final FailureKind kind;

    protected AuthenticatorException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AuthenticatorException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
