package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.AuthenticationOutcome;
import warden.core.model.auth.AuthenticationSession;
import warden.core.model.auth.ConfigValidationResult;
import warden.core.model.request.InboundRequest;
import warden.core.model.rule.Rule;

/**
 * Service Provider Interface for authenticators.
 *
 * <p>An authenticator inspects an inbound request, decides whether it is responsible
 * for it, and if so validates the presented credential. Implementations are discovered
 * via CDI and looked up by {@link #id()} when a rule names them.
 *
 * <h2>Built-in Authenticators</h2>
 * <ul>
 *   <li><b>oauth2_introspection</b>: validates opaque bearer tokens against an
 *       RFC 7662 introspection endpoint</li>
 * </ul>
 *
 * <h2>How to Create a Custom Authenticator</h2>
 * <ol>
 *   <li>Implement this interface as a CDI bean (@ApplicationScoped)</li>
 *   <li>Return a unique identifier from {@link #id()}</li>
 *   <li>Implement {@link #authenticate} and {@link #validate}</li>
 *   <li>Never throw from {@link #authenticate}; report problems as a
 *       {@link AuthenticationOutcome.Failure}</li>
 * </ol>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class ApiKeyAuthenticator implements Authenticator {
 *     @Override
 *     public String id() { return "api_key"; }
 *
 *     @Override
 *     public Uni<AuthenticationOutcome> authenticate(
 *             InboundRequest request, AuthenticationSession session, byte[] config, Rule rule) {
 *         var key = request.header("X-API-Key");
 *         if (key.isEmpty()) {
 *             return Uni.createFrom().item(AuthenticationOutcome.notResponsible());
 *         }
 *         // Validate key...
 *         session.setSubject(owner);
 *         return Uni.createFrom().item(AuthenticationOutcome.success());
 *     }
 *
 *     @Override
 *     public ConfigValidationResult validate(byte[] config) {
 *         return ConfigValidationResult.valid();
 *     }
 * }
 * }</pre>
 */
public interface Authenticator {

    /**
     * Stable identifier used by rules to reference this authenticator.
     *
     * @return the authenticator identifier (e.g., "oauth2_introspection")
     */
    String id();

    /**
     * Attempt to authenticate a request.
     *
     * <p>Implementations return:
     * <ul>
     *   <li>{@link AuthenticationOutcome.Success} after populating the session</li>
     *   <li>{@link AuthenticationOutcome.NotResponsible} when no credential is present
     *       at the location this authenticator reads</li>
     *   <li>{@link AuthenticationOutcome.Failure} in every other case</li>
     * </ul>
     *
     * <p>Only a Success may mutate the session.
     *
     * @param request inbound request, read only
     * @param session session to populate on success
     * @param config  raw per-rule JSON configuration
     * @param rule    the rule being evaluated
     * @return the outcome, never a failed Uni
     */
    Uni<AuthenticationOutcome> authenticate(
            InboundRequest request, AuthenticationSession session, byte[] config, Rule rule);

    /**
     * Check that this authenticator is enabled and that the raw configuration decodes
     * into a valid configuration, without any network I/O.
     *
     * @param config raw per-rule JSON configuration
     * @return the validation result
     */
    ConfigValidationResult validate(byte[] config);
}
