package warden.core.exception;

import warden.core.model.auth.FailureKind;

/**
 * Exception thrown when the introspection exchange produced an unusable answer,
 * such as an unexpected status code or a body that is not an introspection response.
 */
public class IntrospectionException extends AuthenticatorException {

    public IntrospectionException(FailureKind kind, String message) {
        super(kind, message);
    }

    public IntrospectionException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
