package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the introspection transports.
 *
 * <p>Configuration prefix: {@code warden.introspection}
 */
@ConfigMapping(prefix = "warden.introspection")
public interface IntrospectionConfig {

    /**
     * Maximum time a single introspection attempt may take before it counts as a
     * transport failure.
     *
     * @return Request timeout duration (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration requestTimeout();

    /**
     * Maximum number of pre-authorized transports kept, one per distinct
     * client-credentials and retry configuration.
     *
     * @return Max cached transports (default: 100)
     */
    @WithDefault("100")
    int transportCacheSize();

    /**
     * Time before expiry at which a cached client-credentials token is refreshed.
     *
     * @return Refresh skew (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration tokenRefreshSkew();

    /**
     * Maximum time a token endpoint call may take.
     *
     * @return Token request timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration tokenRequestTimeout();
}
