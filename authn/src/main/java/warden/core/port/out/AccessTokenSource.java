package warden.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for obtaining the access token the authenticator presents to the introspection endpoint.
 *
 * <p>Implementations cache the token and are safe for concurrent use.
 */
@FunctionalInterface
public interface AccessTokenSource {

    /**
     * A currently valid access token.
     *
     * <p>Fails with a {@link warden.core.exception.TransportException} if no token could be obtained.
     */
    Uni<String> token();
}
