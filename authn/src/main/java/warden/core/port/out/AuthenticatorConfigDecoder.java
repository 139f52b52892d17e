package warden.core.port.out;

/**
 * Port for decoding a raw per-rule authenticator configuration.
 */
public interface AuthenticatorConfigDecoder {

    /**
     * Decode the raw configuration, layered over the deployment defaults of the authenticator.
     *
     * @param authenticatorId identifier of the authenticator the configuration belongs to
     * @param rawConfig       raw JSON, empty when the rule configures nothing
     * @param type            target type
     * @return the decoded configuration
     * @throws warden.core.exception.ConfigurationException if the JSON is malformed,
     *         has unknown members or members of the wrong type
     */
    <T> T decode(String authenticatorId, byte[] rawConfig, Class<T> type);

    /**
     * Whether the authenticator is enabled in the deployment configuration.
     */
    boolean isEnabled(String authenticatorId);
}
