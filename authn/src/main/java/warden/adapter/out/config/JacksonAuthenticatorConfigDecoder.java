package warden.adapter.out.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import warden.core.config.AuthenticatorsConfig;
import warden.core.exception.ConfigurationException;
import warden.core.port.out.AuthenticatorConfigDecoder;

/**
 * Strict Jackson decoder for authenticator configuration.
 *
 * <p>The rule's JSON object is deep-merged over the authenticator defaults from
 * {@code warden.authenticators.<id>.config}; nested objects merge member by member,
 * everything else in the rule replaces the default. Unknown members, wrong types and
 * trailing content are rejected.
 */
@ApplicationScoped
public class JacksonAuthenticatorConfigDecoder implements AuthenticatorConfigDecoder {

    private static final Logger LOG = Logger.getLogger(JacksonAuthenticatorConfigDecoder.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();

    private final AuthenticatorsConfig config;

    @Inject
    public JacksonAuthenticatorConfigDecoder(AuthenticatorsConfig config) {
        this.config = config;
    }

    @Override
    public <T> T decode(String authenticatorId, byte[] rawConfig, Class<T> type) {
        final var merged = defaults(authenticatorId);
        merge(merged, readObject(rawConfig, "rule configuration of " + authenticatorId));
        try {
            return OBJECT_MAPPER.treeToValue(merged, type);
        } catch (IOException | IllegalArgumentException e) {
            LOG.debugf("Rejected configuration of %s: %s", authenticatorId, e.getMessage());
            throw new ConfigurationException(
                    "Invalid configuration for authenticator %s: %s".formatted(authenticatorId, e.getMessage()), e);
        }
    }

    @Override
    public boolean isEnabled(String authenticatorId) {
        return handler(authenticatorId).map(AuthenticatorsConfig.Handler::enabled).orElse(false);
    }

    private ObjectNode defaults(String authenticatorId) {
        return handler(authenticatorId)
                .flatMap(AuthenticatorsConfig.Handler::config)
                .map(json -> readObject(json.getBytes(StandardCharsets.UTF_8),
                        "default configuration of " + authenticatorId))
                .orElseGet(OBJECT_MAPPER::createObjectNode);
    }

    private Optional<AuthenticatorsConfig.Handler> handler(String authenticatorId) {
        return Optional.ofNullable(config.handlers().get(authenticatorId));
    }

    private static ObjectNode readObject(byte[] json, String description) {
        if (json == null || new String(json, StandardCharsets.UTF_8).isBlank()) {
            return OBJECT_MAPPER.createObjectNode();
        }
        final JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed JSON in %s: %s".formatted(description, e.getMessage()), e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OBJECT_MAPPER.createObjectNode();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("%s must be a JSON object".formatted(description));
        }
        return (ObjectNode) node;
    }

    private static void merge(ObjectNode target, ObjectNode override) {
        override.fields().forEachRemaining(entry -> {
            final var existing = target.get(entry.getKey());
            if (existing instanceof ObjectNode existingObject && entry.getValue() instanceof ObjectNode overrideObject) {
                merge(existingObject, overrideObject);
            } else {
                target.set(entry.getKey(), entry.getValue());
            }
        });
    }
}
