package warden.core.model.auth;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client-credentials settings the authenticator uses to authenticate itself to the
 * introspection endpoint.
 *
 * @param enabled      whether pre-authorization is active
 * @param clientId     OAuth2 client ID
 * @param clientSecret OAuth2 client secret
 * @param scope        scopes requested for the authenticator's own token
 * @param tokenUrl     absolute URL of the token endpoint
 */
public record PreAuthorizationConfiguration(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("scope") List<String> scope,
        @JsonProperty("token_url") String tokenUrl) {

    public PreAuthorizationConfiguration {
        scope = scope == null ? List.of() : List.copyOf(scope);
    }

    @Override
    public String toString() {
        return "PreAuthorizationConfiguration[enabled=" + enabled
                + ", clientId=" + clientId
                + ", clientSecret=***"
                + ", scope=" + scope
                + ", tokenUrl=" + tokenUrl + "]";
    }
}
