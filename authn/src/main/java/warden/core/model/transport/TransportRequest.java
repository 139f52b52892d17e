package warden.core.model.transport;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * An outbound HTTP request issued by an authenticator.
 *
 * <p>Header names are case-insensitive; a later value for the same name replaces the earlier one.
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body) {

    public TransportRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri is required");
        }
        final var normalized = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            normalized.putAll(headers);
        }
        headers = Collections.unmodifiableMap(normalized);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Copy of this request with one header set, replacing any value of the same name.
     */
    public TransportRequest withHeader(String name, String value) {
        final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.put(name, value);
        return new TransportRequest(method, uri, copy, body);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
