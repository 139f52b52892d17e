package warden.core.model.auth;

import java.util.List;
import java.util.Locale;

/**
 * Comparison semantics deciding whether a granted scope satisfies a required scope.
 *
 * <p>Scopes are dot-separated ({@code photos.read}). {@link #NONE} disables the
 * client-side check: the required scopes are sent to the introspection endpoint instead.
 */
public enum ScopeStrategy {

    /** No client-side check. */
    NONE("none"),

    /** The required scope must equal one of the granted scopes. */
    EXACT("exact"),

    /** A granted scope satisfies every scope below it: {@code photos} grants {@code photos.read}. */
    HIERARCHIC("hierarchic"),

    /** A {@code *} segment in a granted scope matches any segment: {@code photos.*} grants {@code photos.read}. */
    WILDCARD("wildcard");

    private final String configName;

    ScopeStrategy(String configName) {
        this.configName = configName;
    }

    /**
     * Whether required scopes are checked against the introspection response.
     */
    public boolean checksClientSide() {
        return this != NONE;
    }

    /**
     * Resolve a strategy from its configuration name.
     *
     * @param name the configured name, case-insensitive; null or blank selects {@link #NONE}
     * @return the strategy
     * @throws IllegalArgumentException if the name is not a known strategy
     */
    public static ScopeStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final var strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown scope strategy '%s', expected one of hierarchic, exact, wildcard, none"
                .formatted(name));
    }

    /**
     * Check whether the granted scopes satisfy a required scope.
     *
     * @param granted  scopes granted to the token
     * @param required the scope the rule requires
     * @return true if the scope is granted; always true for {@link #NONE}
     */
    public boolean isGranted(List<String> granted, String required) {
        return switch (this) {
            case NONE -> true;
            case EXACT -> granted.contains(required);
            case HIERARCHIC -> granted.stream().anyMatch(scope -> hierarchicMatch(scope, required));
            case WILDCARD -> granted.stream().anyMatch(scope -> wildcardMatch(scope, required));
        };
    }

    private static boolean hierarchicMatch(String granted, String required) {
        if (granted.equals(required)) {
            return true;
        }
        if (granted.length() > required.length()) {
            return false;
        }
        final var requiredParts = required.split("\\.", -1);
        final var grantedParts = granted.split("\\.", -1);
        for (int i = 0; i < requiredParts.length; i++) {
            if (i >= grantedParts.length) {
                return true;
            }
            if (!grantedParts[i].equals(requiredParts[i])) {
                return false;
            }
        }
        return false;
    }

    private static boolean wildcardMatch(String pattern, String required) {
        final var requiredParts = required.split("\\.", -1);
        final var patternParts = pattern.split("\\.", -1);
        if (patternParts.length > requiredParts.length) {
            return false;
        }
        for (int i = 0; i < patternParts.length; i++) {
            final var part = patternParts[i];
            // a trailing wildcard on a shorter pattern covers the remaining segments
            if (i == patternParts.length - 1 && patternParts.length != requiredParts.length) {
                return part.equals("*") && !requiredParts[i].isEmpty();
            }
            if (part.equals("*") && !requiredParts[i].isEmpty()) {
                continue;
            }
            if (!part.equals(requiredParts[i])) {
                return false;
            }
        }
        return true;
    }
}
