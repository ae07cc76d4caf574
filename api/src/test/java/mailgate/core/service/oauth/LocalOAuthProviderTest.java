package mailgate.core.service.oauth;

import static mailgate.core.service.oauth.OAuthTestHarness.AWAIT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import mailgate.core.config.TestOAuthConfig;

@DisplayName("LocalOAuthProvider")
class LocalOAuthProviderTest {

    private OAuthTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new OAuthTestHarness(new TestOAuthConfig().withBaseUrl("https://mail.example/"));
    }

    @Nested
    @DisplayName("clients")
    class ClientTests {

        @Test
        @DisplayName("should register and look up a client")
        void shouldRegisterClient() {
            var client = OAuthTestHarness.client("c1", "mail.read");

            harness.provider.registerClient(client).await().atMost(AWAIT);

            assertEquals(client, harness.provider.getClient("c1").await().atMost(AWAIT).orElseThrow());
            verify(harness.metrics).recordClientRegistered();
        }

        @Test
        @DisplayName("should report unknown and blank client ids as absent")
        void shouldReturnEmptyForUnknown() {
            assertTrue(harness.provider.getClient("missing").await().atMost(AWAIT).isEmpty());
            assertTrue(harness.provider.getClient(" ").await().atMost(AWAIT).isEmpty());
            assertTrue(harness.provider.getClient(null).await().atMost(AWAIT).isEmpty());
        }
    }

    @Nested
    @DisplayName("authorize()")
    class AuthorizeTests {

        @Test
        @DisplayName("should park the request and point at the consent page")
        void shouldCreatePendingTransaction() {
            var client = harness.register(OAuthTestHarness.client("c1", "mail.read mail.send"));

            var url = harness.provider
                    .authorize(client, OAuthTestHarness.params(null))
                    .await()
                    .atMost(AWAIT);

            assertTrue(url.toString().startsWith("https://mail.example/oauth/consent?tx="));
            var tx = url.getQuery().substring("tx=".length());
            var pending = harness.pending
                    .findActive(tx, harness.clock.instant(), Duration.ofMinutes(10))
                    .await()
                    .atMost(AWAIT)
                    .orElseThrow();
            assertEquals(List.of("mail.read", "mail.send"), pending.scopes());
            assertEquals(harness.clock.instant(), pending.createdAt());
            assertEquals("c1", pending.client().clientId());
        }

        @Test
        @DisplayName("should issue a fresh transaction for every request")
        void shouldIssueDistinctTransactions() {
            var client = harness.register(OAuthTestHarness.client("c1", "mail.read"));

            var first = harness.startAuthorization(client, OAuthTestHarness.params(null));
            var second = harness.startAuthorization(client, OAuthTestHarness.params(null));

            assertNotEquals(first, second);
            assertEquals(2, harness.pending.size());
        }
    }

    @Test
    @DisplayName("should expose the configured routes")
    void shouldExposeRoutes() {
        var names = harness.provider.getRoutes().stream().map(r -> r.name()).toList();

        assertEquals(List.of("metadata", "authorize", "token", "register", "revoke", "consent"), names);
    }
}
