package warden.core.model.transport;

import java.nio.charset.StandardCharsets;

/**
 * Response received for a {@link TransportRequest}.
 */
public record TransportResponse(int statusCode, byte[] body) {

    public TransportResponse {
        body = body == null ? new byte[0] : body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
