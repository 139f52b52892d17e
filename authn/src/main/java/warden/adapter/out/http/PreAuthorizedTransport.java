package warden.adapter.out.http;

import io.smallrye.mutiny.Uni;

import warden.core.model.transport.TransportRequest;
import warden.core.model.transport.TransportResponse;
import warden.core.port.out.AccessTokenSource;
import warden.core.port.out.IntrospectionTransport;

/**
 * Transport decorator presenting the authenticator's own access token on every request.
 *
 * <p>The token replaces any configured {@code Authorization} header.
 */
public class PreAuthorizedTransport implements IntrospectionTransport {

    private final IntrospectionTransport delegate;
    private final AccessTokenSource tokenSource;

    public PreAuthorizedTransport(IntrospectionTransport delegate, AccessTokenSource tokenSource) {
        this.delegate = delegate;
        this.tokenSource = tokenSource;
    }

    @Override
    public Uni<TransportResponse> send(TransportRequest request) {
        return tokenSource
                .token()
                .flatMap(token -> delegate.send(request.withHeader("Authorization", "Bearer " + token)));
    }
}
