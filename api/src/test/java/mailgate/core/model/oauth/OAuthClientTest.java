package mailgate.core.model.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OAuthClient")
class OAuthClientTest {

    static OAuthClient client(String clientId, String... redirectUris) {
        return new OAuthClient(
                clientId,
                "secret",
                1L,
                0L,
                null,
                List.of(redirectUris),
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null);
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should apply grant, response type and auth method defaults")
        void shouldApplyDefaults() {
            var client = client("client-a", "https://cb/");

            assertEquals(List.of("authorization_code", "refresh_token"), client.grantTypes());
            assertEquals(List.of("code"), client.responseTypes());
            assertEquals("client_secret_post", client.tokenEndpointAuthMethod());
        }

        @Test
        @DisplayName("should reject missing redirect URIs")
        void shouldRejectMissingRedirectUris() {
            assertThrows(IllegalArgumentException.class, () -> client("client-a"));
        }

        @Test
        @DisplayName("should reject relative redirect URIs")
        void shouldRejectRelativeRedirectUris() {
            assertThrows(IllegalArgumentException.class, () -> client("client-a", "/callback"));
        }

        @Test
        @DisplayName("should fall back to the client id as display name")
        void shouldFallBackToClientId() {
            assertEquals("client-a", client("client-a", "https://cb/").displayName());
        }
    }

    @Nested
    @DisplayName("resolveRedirectUri()")
    class ResolveRedirectUriTests {

        @Test
        @DisplayName("should accept a registered explicit URI")
        void shouldAcceptRegisteredUri() {
            var client = client("client-a", "https://a/cb", "https://b/cb");

            assertEquals(Optional.of("https://b/cb"), client.resolveRedirectUri("https://b/cb"));
        }

        @Test
        @DisplayName("should reject an unregistered explicit URI")
        void shouldRejectUnregisteredUri() {
            var client = client("client-a", "https://a/cb");

            assertTrue(client.resolveRedirectUri("https://evil/cb").isEmpty());
        }

        @Test
        @DisplayName("should default to the only registered URI")
        void shouldDefaultToOnlyUri() {
            var client = client("client-a", "https://a/cb");

            assertEquals(Optional.of("https://a/cb"), client.resolveRedirectUri(null));
        }

        @Test
        @DisplayName("should require an explicit URI when several are registered")
        void shouldRequireExplicitUri() {
            var client = client("client-a", "https://a/cb", "https://b/cb");

            assertTrue(client.resolveRedirectUri(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("should use RFC 7591 field names and skip derived properties")
        void shouldUseWireNames() throws Exception {
            var json = mapper.readTree(mapper.writeValueAsString(client("client-a", "https://cb/")));

            assertEquals("client-a", json.get("client_id").asText());
            assertEquals("https://cb/", json.get("redirect_uris").get(0).asText());
            assertFalse(json.has("display_name"));
            assertFalse(json.has("displayName"));
            assertFalse(json.has("public"));
            assertFalse(json.has("client_name"));
        }

        @Test
        @DisplayName("should ignore unknown properties when reading")
        void shouldIgnoreUnknownProperties() throws Exception {
            var client = mapper.readValue(
                    "{\"client_id\":\"c\",\"redirect_uris\":[\"https://cb/\"],\"jwks_uri\":\"https://x\"}",
                    OAuthClient.class);

            assertEquals("c", client.clientId());
            assertTrue(client.isPublic());
        }
    }
}
