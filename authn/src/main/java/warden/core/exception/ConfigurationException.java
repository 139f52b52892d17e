package warden.core.exception;

import warden.core.model.auth.FailureKind;

/**
 * Exception thrown when an authenticator configuration cannot be decoded or is invalid.
 */
public class ConfigurationException extends AuthenticatorException {

    public ConfigurationException(String message) {
        super(FailureKind.MISCONFIGURED, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureKind.MISCONFIGURED, message, cause);
    }
}
