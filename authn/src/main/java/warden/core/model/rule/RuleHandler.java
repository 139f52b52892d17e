package warden.core.model.rule;

import java.nio.charset.StandardCharsets;

/**
 * An authenticator reference inside a rule, with the rule's raw configuration for it.
 *
 * @param handler identifier of the authenticator
 * @param config  raw JSON configuration, empty when the rule configures nothing
 */
public record RuleHandler(String handler, byte[] config) {

    public RuleHandler {
        if (handler == null || handler.isBlank()) {
            throw new IllegalArgumentException("handler is required");
        }
        config = config == null ? new byte[0] : config.clone();
    }

    public static RuleHandler of(String handler, String json) {
        return new RuleHandler(handler, json == null ? null : json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] config() {
        return config.clone();
    }
}
