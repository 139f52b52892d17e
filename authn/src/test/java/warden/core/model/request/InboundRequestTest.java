package warden.core.model.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InboundRequest")
class InboundRequestTest {

    @Test
    @DisplayName("should look up headers case-insensitively")
    void shouldLookUpHeadersCaseInsensitively() {
        var request = InboundRequest.of("GET", "https://api.example.com/", Map.of("x-access-token", List.of("abc")));

        assertEquals(Optional.of("abc"), request.header("X-Access-Token"));
        assertTrue(request.header("X-Other").isEmpty());
    }

    @Test
    @DisplayName("should decode query parameters")
    void shouldDecodeQueryParameters() {
        var request = InboundRequest.of("GET", "https://api.example.com/photos?a=1&access%5Ftoken=ab%2Bc%20d&flag", Map.of());

        assertEquals(Optional.of("ab+c d"), request.queryParameter("access_token"));
        assertEquals(Optional.of("1"), request.queryParameter("a"));
        assertEquals(Optional.of(""), request.queryParameter("flag"));
        assertTrue(request.queryParameter("missing").isEmpty());
    }

    @Test
    @DisplayName("should read cookies from every Cookie header")
    void shouldReadCookies() {
        var request = InboundRequest.of(
                "GET",
                "https://api.example.com/",
                Map.of("Cookie", List.of("theme=dark; session=\"s-1\"", "token=t-2")));

        assertEquals(Optional.of("s-1"), request.cookie("session"));
        assertEquals(Optional.of("t-2"), request.cookie("token"));
        assertTrue(request.cookie("missing").isEmpty());
    }
}
