package warden.core.exception;

import warden.core.model.auth.FailureKind;

/**
 * Exception thrown when an outbound request could not complete.
 *
 * <p>Connection refused, reset, DNS failure, timeout and a failed token fetch all
 * surface as this exception. It is the only failure a resilient transport retries.
 */
public class TransportException extends AuthenticatorException {

    public TransportException(String message) {
        super(FailureKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(FailureKind.TRANSPORT, message, cause);
    }
}
