package warden.core.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where to read the bearer token from in the inbound request.
 *
 * <p>Exactly one of the three locations may be set. When none is configured the
 * token is read from the {@code Authorization} header using the {@code Bearer} scheme.
 *
 * @param header         name of a request header
 * @param queryParameter name of a query parameter
 * @param cookie         name of a cookie
 */
public record BearerTokenLocation(
        @JsonProperty("header") String header,
        @JsonProperty("query_parameter") String queryParameter,
        @JsonProperty("cookie") String cookie) {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final BearerTokenLocation DEFAULT = new BearerTokenLocation(AUTHORIZATION_HEADER, null, null);

    public static BearerTokenLocation defaultLocation() {
        return DEFAULT;
    }

    public static BearerTokenLocation header(String name) {
        return new BearerTokenLocation(name, null, null);
    }

    public static BearerTokenLocation queryParameter(String name) {
        return new BearerTokenLocation(null, name, null);
    }

    public static BearerTokenLocation cookie(String name) {
        return new BearerTokenLocation(null, null, name);
    }

    /**
     * Number of locations set on this descriptor.
     */
    public int configuredLocations() {
        int count = 0;
        if (header != null) {
            count++;
        }
        if (queryParameter != null) {
            count++;
        }
        if (cookie != null) {
            count++;
        }
        return count;
    }

    /**
     * Whether the token is read from the {@code Authorization} header with the {@code Bearer} scheme.
     */
    public boolean isAuthorizationHeader() {
        return header != null && header.equalsIgnoreCase(AUTHORIZATION_HEADER);
    }
}
