package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, non-reversible fingerprint of a credential for log lines.
 *
 * <p>Credentials themselves are never logged; the fingerprint lets operators correlate
 * log lines about the same token.
 */
public final class TokenFingerprint {

    private static final int HEX_CHARS = 12;

    private TokenFingerprint() {}

    /**
     * Return the first twelve hex characters of the SHA-256 digest of the credential.
     */
    public static String of(String credential) {
        if (credential == null) {
            return "none";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(credential.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes).substring(0, HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 not available", e);
        }
    }
}
