package warden.core.model.auth;

public sealed interface ConfigValidationResult {

    record Valid() implements ConfigValidationResult {}

    record Invalid(FailureKind kind, String reason) implements ConfigValidationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }

    default boolean isInvalid() {
        return this instanceof Invalid;
    }

    static ConfigValidationResult valid() {
        return new Valid();
    }

    static ConfigValidationResult invalid(FailureKind kind, String reason) {
        return new Invalid(kind, reason);
    }

    static ConfigValidationResult notEnabled(String authenticatorId) {
        return new Invalid(FailureKind.NOT_ENABLED, "Authenticator '%s' is disabled".formatted(authenticatorId));
    }

    static ConfigValidationResult misconfigured(String reason) {
        return new Invalid(FailureKind.MISCONFIGURED, reason);
    }
}
