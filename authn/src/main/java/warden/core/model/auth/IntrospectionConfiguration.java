package warden.core.model.auth;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-rule configuration of the OAuth2 introspection authenticator.
 *
 * <h2>Example Configuration</h2>
 * <pre>{@code
 * {
 *   "introspection_url": "https://auth.example.com/oauth2/introspect",
 *   "required_scope": ["photos.read"],
 *   "target_audience": ["photos-api"],
 *   "trusted_issuers": ["https://auth.example.com/"],
 *   "scope_strategy": "hierarchic",
 *   "token_from": { "header": "X-Access-Token" },
 *   "introspection_request_headers": { "X-Forwarded-Proto": "https" },
 *   "pre_authorization": {
 *     "enabled": true,
 *     "client_id": "warden",
 *     "client_secret": "...",
 *     "scope": ["introspect"],
 *     "token_url": "https://auth.example.com/oauth2/token"
 *   },
 *   "retry": { "max_delay": "300ms", "give_up_after": "2s" }
 * }
 * }</pre>
 *
 * @param requiredScope               scopes the token must have been granted
 * @param targetAudience              audiences the token must be intended for
 * @param trustedIssuers              accepted issuers, empty to skip the issuer check
 * @param preAuthorization            client-credentials settings used to call the endpoint, may be null
 * @param scopeStrategy               name of the {@link ScopeStrategy}, may be null
 * @param introspectionUrl            absolute URL of the introspection endpoint
 * @param tokenFrom                   bearer token location, null for the default
 * @param introspectionRequestHeaders extra headers sent with the introspection request
 * @param retry                       retry settings, only used with pre-authorization
 */
public record IntrospectionConfiguration(
        @JsonProperty("required_scope") List<String> requiredScope,
        @JsonProperty("target_audience") List<String> targetAudience,
        @JsonProperty("trusted_issuers") List<String> trustedIssuers,
        @JsonProperty("pre_authorization") PreAuthorizationConfiguration preAuthorization,
        @JsonProperty("scope_strategy") String scopeStrategy,
        @JsonProperty("introspection_url") String introspectionUrl,
        @JsonProperty("token_from") BearerTokenLocation tokenFrom,
        @JsonProperty("introspection_request_headers") Map<String, String> introspectionRequestHeaders,
        @JsonProperty("retry") RetryConfiguration retry) {

    public IntrospectionConfiguration {
        requiredScope = requiredScope == null ? List.of() : List.copyOf(requiredScope);
        targetAudience = targetAudience == null ? List.of() : List.copyOf(targetAudience);
        trustedIssuers = trustedIssuers == null ? List.of() : List.copyOf(trustedIssuers);
        introspectionRequestHeaders =
                introspectionRequestHeaders == null ? Map.of() : Map.copyOf(introspectionRequestHeaders);
    }

    public boolean isPreAuthorizationEnabled() {
        return preAuthorization != null && preAuthorization.enabled();
    }

    public IntrospectionConfiguration withRetry(RetryConfiguration retry) {
        return new IntrospectionConfiguration(
                requiredScope,
                targetAudience,
                trustedIssuers,
                preAuthorization,
                scopeStrategy,
                introspectionUrl,
                tokenFrom,
                introspectionRequestHeaders,
                retry);
    }
}
