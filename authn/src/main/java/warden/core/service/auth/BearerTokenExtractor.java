package warden.core.service.auth;

import java.util.Optional;

import warden.core.model.auth.BearerTokenLocation;
import warden.core.model.request.InboundRequest;

/**
 * Pulls a bearer token out of an inbound request.
 */
public final class BearerTokenExtractor {

    private static final String BEARER_SCHEME = "bearer";

    private BearerTokenExtractor() {}

    /**
     * Extract the token from the given location.
     *
     * <p>The {@code Authorization} header must use the {@code Bearer} scheme (matched
     * case-insensitively); any other header is read verbatim. An empty value counts as absent.
     *
     * @param request  the inbound request
     * @param location where to look, null for the {@code Authorization} header
     * @return the token, or empty if none is present
     */
    public static Optional<String> extract(InboundRequest request, BearerTokenLocation location) {
        final var effective = location == null ? BearerTokenLocation.defaultLocation() : location;

        Optional<String> token;
        if (effective.isAuthorizationHeader()) {
            token = request.header(effective.header()).flatMap(BearerTokenExtractor::fromAuthorization);
        } else if (effective.header() != null) {
            token = request.header(effective.header());
        } else if (effective.queryParameter() != null) {
            token = request.queryParameter(effective.queryParameter());
        } else if (effective.cookie() != null) {
            token = request.cookie(effective.cookie());
        } else {
            token = Optional.empty();
        }
        return token.filter(value -> !value.isEmpty());
    }

    private static Optional<String> fromAuthorization(String value) {
        final var separator = value.indexOf(' ');
        if (separator < 0) {
            return Optional.empty();
        }
        if (!value.substring(0, separator).equalsIgnoreCase(BEARER_SCHEME)) {
            return Optional.empty();
        }
        return Optional.of(value.substring(separator + 1));
    }
}
