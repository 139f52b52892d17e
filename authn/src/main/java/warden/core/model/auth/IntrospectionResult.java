package warden.core.model.auth;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token introspection response (RFC 7662).
 *
 * <p>A missing {@code active} member decodes as {@code false}. {@code aud} is accepted
 * both as a single string and as an array.
 *
 * @param active    whether the token is currently active
 * @param extra     extension claims ({@code ext}), may be null
 * @param subject   the token subject ({@code sub})
 * @param username  human-readable identifier of the resource owner
 * @param audience  audiences the token is intended for ({@code aud})
 * @param tokenType type of the token, e.g. {@code access_token}
 * @param issuer    the token issuer ({@code iss})
 * @param clientId  client the token was issued to
 * @param scope     space-delimited granted scopes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntrospectionResult(
        @JsonProperty("active") boolean active,
        @JsonProperty("ext") Map<String, Object> extra,
        @JsonProperty("sub") String subject,
        @JsonProperty("username") String username,
        @JsonProperty("aud") @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> audience,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("iss") String issuer,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("scope") String scope) {

    public static final String ACCESS_TOKEN_TYPE = "access_token";

    public IntrospectionResult {
        audience = audience == null ? List.of() : audience;
    }

    public boolean hasTokenType() {
        return tokenType != null && !tokenType.isEmpty();
    }

    public boolean isAccessToken() {
        return ACCESS_TOKEN_TYPE.equals(tokenType);
    }

    /**
     * Granted scopes, split on single spaces.
     */
    public List<String> grantedScopes() {
        return List.of((scope == null ? "" : scope).split(" ", -1));
    }

    /**
     * Extension claims merged with {@code username}, {@code client_id} and {@code scope}.
     *
     * <p>Returns a new mutable map; the merged keys overwrite same-named extension claims.
     */
    public Map<String, Object> sessionClaims() {
        final var claims = extra == null ? new HashMap<String, Object>() : new HashMap<>(extra);
        claims.put("username", nullToEmpty(username));
        claims.put("client_id", nullToEmpty(clientId));
        claims.put("scope", nullToEmpty(scope));
        return claims;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
