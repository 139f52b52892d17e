package warden.core.model.auth;

/**
 * Represents the outcome of a single authenticator invocation.
 *
 * This is a sealed interface with three possible outcomes:
 * - Success: the credential was accepted and the session was mutated in place
 * - NotResponsible: the authenticator does not apply to this request (no credential
 *   at its configured location); the dispatcher must try the next authenticator
 * - Failure: the authenticator applied but rejected the request, or could not decide
 */
public sealed interface AuthenticationOutcome {

    /**
     * Authentication succeeded.
     */
    record Success() implements AuthenticationOutcome {
        private static final Success INSTANCE = new Success();

        public static Success instance() {
            return INSTANCE;
        }
    }

    /**
     * The authenticator does not handle this request.
     * The dispatcher should try the next authenticator.
     */
    record NotResponsible() implements AuthenticationOutcome {
        private static final NotResponsible INSTANCE = new NotResponsible();

        public static NotResponsible instance() {
            return INSTANCE;
        }
    }

    /**
     * Authentication failed.
     *
     * @param kind   classification of the failure
     * @param detail human-readable description of the failing check
     * @param cause  underlying exception, or null when the failure is a policy decision
     */
    record Failure(FailureKind kind, String detail, Throwable cause) implements AuthenticationOutcome {
        public Failure {
            if (kind == null) {
                throw new IllegalArgumentException("Failure kind cannot be null");
            }
            if (detail == null || detail.isBlank()) {
                detail = "Authentication failed (" + kind.label() + ")";
            }
        }

        public Failure(FailureKind kind, String detail) {
            this(kind, detail, null);
        }

        /**
         * HTTP status code the caller should answer the rejected request with.
         */
        public int statusCode() {
            return kind.statusCode();
        }
    }

    static AuthenticationOutcome success() {
        return Success.instance();
    }

    static AuthenticationOutcome notResponsible() {
        return NotResponsible.instance();
    }

    static AuthenticationOutcome failure(FailureKind kind, String detail) {
        return new Failure(kind, detail);
    }

    static AuthenticationOutcome failure(FailureKind kind, String detail, Throwable cause) {
        return new Failure(kind, detail, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isNotResponsible() {
        return this instanceof NotResponsible;
    }

    /**
     * Label used for metric tags: {@code success}, {@code not_responsible} or the failure kind.
     */
    default String label() {
        if (this instanceof Failure failure) {
            return failure.kind().label();
        }
        return isSuccess() ? "success" : "not_responsible";
    }
}
