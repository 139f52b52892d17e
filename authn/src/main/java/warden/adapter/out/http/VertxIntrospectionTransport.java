package warden.adapter.out.http;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import org.jboss.logging.Logger;

import warden.core.exception.TransportException;
import warden.core.model.transport.TransportRequest;
import warden.core.model.transport.TransportResponse;
import warden.core.port.out.IntrospectionTransport;

/**
 * Plain HTTP transport on the Vert.x HTTP client.
 *
 * <p>Each exchange is bounded by the request timeout. Cancelling the returned Uni, or the
 * timeout elapsing, resets the in-flight HTTP request so the exchange does not outlive
 * the caller. Every failure is reported as a {@link TransportException}.
 */
public class VertxIntrospectionTransport implements IntrospectionTransport {

    private static final Logger LOG = Logger.getLogger(VertxIntrospectionTransport.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public VertxIntrospectionTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Uni<TransportResponse> send(TransportRequest request) {
        final var options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(request.method()))
                .setAbsoluteURI(request.uri().toString());
        request.headers().forEach(options::addHeader);

        final var inFlight = new AtomicReference<HttpClientRequest>();
        return httpClient
                .request(options)
                .invoke(inFlight::set)
                .flatMap(clientRequest -> clientRequest.send(Buffer.buffer(request.body())))
                .flatMap(response -> response.body()
                        .map(body -> new TransportResponse(response.statusCode(), body.getBytes())))
                .onCancellation()
                .invoke(() -> reset(inFlight.get(), request))
                .ifNoItem()
                .after(requestTimeout)
                .failWith(() -> new TransportException(
                        "Timeout calling %s after %s".formatted(request.uri(), requestTimeout)))
                .onFailure(error -> !(error instanceof TransportException))
                .transform(error -> new TransportException(
                        "Request to %s failed: %s".formatted(request.uri(), error.getMessage()), error));
    }

    private static void reset(HttpClientRequest clientRequest, TransportRequest request) {
        if (clientRequest != null) {
            LOG.debugf("Resetting request to %s", request.uri());
            clientRequest.reset();
        }
    }
}
