package warden.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithParentName;

/**
 * Deployment-level settings of each authenticator, keyed by authenticator identifier.
 *
 * <p>Configuration prefix: {@code warden.authenticators}
 *
 * <p>Example configuration:
 * <pre>{@code
 * warden.authenticators.oauth2_introspection.enabled=true
 * warden.authenticators.oauth2_introspection.config={"scope_strategy":"exact"}
 * }</pre>
 *
 * <p>Per-rule configuration is deep-merged over {@link Handler#config()}, the rule winning.
 */
@ConfigMapping(prefix = "warden.authenticators")
public interface AuthenticatorsConfig {

    @WithParentName
    Map<String, Handler> handlers();

    /**
     * Settings of one authenticator.
     */
    interface Handler {

        /**
         * Whether rules may use this authenticator.
         *
         * @return true if enabled (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Default configuration as a JSON object.
         */
        Optional<String> config();
    }
}
