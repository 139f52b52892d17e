package warden.core.model.request;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The inbound request as seen by the authentication stage.
 *
 * <p>Header names are case-insensitive.
 */
public record InboundRequest(String method, URI uri, Map<String, List<String>> headers) {

    public InboundRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri is required");
        }
        final var normalized = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> normalized
                    .computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(values == null ? List.of() : values));
        }
        headers = Collections.unmodifiableMap(normalized);
    }

    public static InboundRequest of(String method, String uri, Map<String, List<String>> headers) {
        return new InboundRequest(method, URI.create(uri), headers);
    }

    /**
     * First value of a header.
     */
    public Optional<String> header(String name) {
        final var values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    /**
     * First value of a query parameter, URL-decoded.
     */
    public Optional<String> queryParameter(String name) {
        final var query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }
        for (final var pair : query.split("&")) {
            final var separator = pair.indexOf('=');
            final var key = separator < 0 ? pair : pair.substring(0, separator);
            if (decode(key).equals(name)) {
                return Optional.of(separator < 0 ? "" : decode(pair.substring(separator + 1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Value of a cookie sent in the {@code Cookie} header(s).
     */
    public Optional<String> cookie(String name) {
        final var cookieHeaders = headers.get("Cookie");
        if (cookieHeaders == null) {
            return Optional.empty();
        }
        for (final var header : cookieHeaders) {
            if (header == null) {
                continue;
            }
            for (final var part : header.split(";")) {
                final var separator = part.indexOf('=');
                if (separator < 0) {
                    continue;
                }
                if (part.substring(0, separator).trim().equals(name)) {
                    return Optional.of(unquote(part.substring(separator + 1).trim()));
                }
            }
        }
        return Optional.empty();
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
