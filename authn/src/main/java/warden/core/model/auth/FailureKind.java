package warden.core.model.auth;

/**
 * Classification of a failed authentication attempt.
 *
 * <p>Each kind carries the HTTP status the caller should answer the rejected
 * request with. {@link #UNAUTHORIZED} and {@link #FORBIDDEN} describe the
 * presented credential; the remaining kinds describe the authenticator itself.
 */
public enum FailureKind {

    /** The authenticator is administratively disabled. */
    NOT_ENABLED(500),

    /** The authenticator configuration could not be decoded or is invalid. */
    MISCONFIGURED(500),

    /** A credential was presented but is not active. */
    UNAUTHORIZED(401),

    /** The credential is active but fails token type, audience, issuer or scope policy. */
    FORBIDDEN(403),

    /** The introspection endpoint could not be reached or answered with an unexpected status. */
    TRANSPORT(502),

    /** The introspection endpoint answered with a body that is not a valid introspection response. */
    DECODE(502);

    private final int statusCode;

    FailureKind(int statusCode) {
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Lower-case label used for metric tags and log lines.
     */
    public String label() {
        return name().toLowerCase();
    }
}
