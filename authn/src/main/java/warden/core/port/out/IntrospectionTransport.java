package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.transport.TransportRequest;
import warden.core.model.transport.TransportResponse;

/**
 * Port for sending an outbound HTTP request to an introspection endpoint.
 *
 * <p>Any HTTP response, whatever its status, completes the returned Uni. A request that
 * could not complete fails it with a {@link warden.core.exception.TransportException}.
 * Implementations are immutable and safe for concurrent use.
 */
@FunctionalInterface
public interface IntrospectionTransport {

    Uni<TransportResponse> send(TransportRequest request);
}
