package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.BearerTokenLocation;
import warden.core.model.request.InboundRequest;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    private static InboundRequest withHeader(String name, String value) {
        return InboundRequest.of("GET", "https://api.example.com/", Map.of(name, List.of(value)));
    }

    @Nested
    @DisplayName("Authorization header")
    class AuthorizationHeader {

        @Test
        @DisplayName("should read a Bearer token by default")
        void shouldReadBearerToken() {
            var token = BearerTokenExtractor.extract(withHeader("Authorization", "Bearer abc"), null);

            assertEquals(Optional.of("abc"), token);
        }

        @Test
        @DisplayName("should match the scheme case-insensitively")
        void shouldMatchSchemeCaseInsensitively() {
            var token = BearerTokenExtractor.extract(
                    withHeader("authorization", "bEaReR abc"), BearerTokenLocation.defaultLocation());

            assertEquals(Optional.of("abc"), token);
        }

        @Test
        @DisplayName("should ignore other schemes")
        void shouldIgnoreOtherSchemes() {
            assertTrue(BearerTokenExtractor.extract(withHeader("Authorization", "Basic dXNlcjpwYXNz"), null)
                    .isEmpty());
            assertTrue(BearerTokenExtractor.extract(withHeader("Authorization", "Bearer"), null)
                    .isEmpty());
        }

        @Test
        @DisplayName("should treat an empty token as absent")
        void shouldTreatEmptyTokenAsAbsent() {
            assertTrue(BearerTokenExtractor.extract(withHeader("Authorization", "Bearer "), null)
                    .isEmpty());
        }

        @Test
        @DisplayName("should apply the scheme to a configured Authorization header")
        void shouldApplySchemeToConfiguredAuthorizationHeader() {
            var token = BearerTokenExtractor.extract(
                    withHeader("Authorization", "Bearer abc"), BearerTokenLocation.header("authorization"));

            assertEquals(Optional.of("abc"), token);
        }
    }

    @Test
    @DisplayName("should read a custom header verbatim")
    void shouldReadCustomHeaderVerbatim() {
        var token = BearerTokenExtractor.extract(
                withHeader("X-Access-Token", "Bearer abc"), BearerTokenLocation.header("X-Access-Token"));

        assertEquals(Optional.of("Bearer abc"), token);
    }

    @Test
    @DisplayName("should read a query parameter")
    void shouldReadQueryParameter() {
        var request = InboundRequest.of("GET", "https://api.example.com/?access_token=abc", Map.of());

        assertEquals(
                Optional.of("abc"),
                BearerTokenExtractor.extract(request, BearerTokenLocation.queryParameter("access_token")));
    }

    @Test
    @DisplayName("should read a cookie")
    void shouldReadCookie() {
        var request = withHeader("Cookie", "other=1; auth=abc");

        assertEquals(Optional.of("abc"), BearerTokenExtractor.extract(request, BearerTokenLocation.cookie("auth")));
    }

    @Test
    @DisplayName("should not fall back to the Authorization header when another location is configured")
    void shouldNotFallBack() {
        var request = withHeader("Authorization", "Bearer abc");

        assertTrue(BearerTokenExtractor.extract(request, BearerTokenLocation.cookie("auth")).isEmpty());
    }
}
