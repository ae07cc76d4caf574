package mailgate.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import mailgate.core.config.TestOAuthConfig;

@DisplayName("ScopeResolver")
class ScopeResolverTest {

    @Nested
    @DisplayName("source of scopes")
    class SourceTests {

        @Test
        @DisplayName("should use requested scopes verbatim")
        void shouldUseRequestedScopes() {
            var resolver = new ScopeResolver(new TestOAuthConfig());
            var client = OAuthTestHarness.client("c1", "mail.read mail.send");

            assertEquals(
                    List.of("mail.send"), resolver.resolve(client, OAuthTestHarness.params(List.of("mail.send"))));
        }

        @Test
        @DisplayName("should fall back to the client's registered scope")
        void shouldFallBackToClientScope() {
            var resolver = new ScopeResolver(new TestOAuthConfig().withDefaultScopes("calendar.read"));
            var client = OAuthTestHarness.client("c1", "mail.read mail.send");

            assertEquals(List.of("mail.read", "mail.send"), resolver.resolve(client, OAuthTestHarness.params(null)));
        }

        @Test
        @DisplayName("should fall back to default scopes when the client registered none")
        void shouldFallBackToDefaults() {
            var resolver = new ScopeResolver(new TestOAuthConfig().withDefaultScopes("calendar.read"));
            var client = OAuthTestHarness.client("c1", null);

            assertEquals(List.of("calendar.read"), resolver.resolve(client, OAuthTestHarness.params(null)));
        }

        @Test
        @DisplayName("should keep an explicitly empty request empty")
        void shouldKeepExplicitEmptyRequest() {
            var resolver = new ScopeResolver(new TestOAuthConfig().withDefaultScopes("calendar.read"));
            var client = OAuthTestHarness.client("c1", "mail.read");

            assertEquals(List.of(), resolver.resolve(client, OAuthTestHarness.params(List.of())));
        }
    }

    @Test
    @DisplayName("should grant only the required scope when nothing else applies")
    void shouldGrantRequiredScopeOnly() {
        var resolver = new ScopeResolver(new TestOAuthConfig().withRequiredScopes("calendar"));
        var client = OAuthTestHarness.client("c1", null);

        assertEquals(List.of("calendar"), resolver.resolve(client, OAuthTestHarness.params(null)));
    }

    @Nested
    @DisplayName("filtering")
    class FilterTests {

        @Test
        @DisplayName("should drop scopes outside the valid set")
        void shouldDropInvalidScopes() {
            var resolver = new ScopeResolver(new TestOAuthConfig().withValidScopes("mail.read"));
            var client = OAuthTestHarness.client("c1", "mail.read admin");

            assertEquals(List.of("mail.read"), resolver.resolve(client, OAuthTestHarness.params(null)));
        }

        @Test
        @DisplayName("should append required scopes even when not valid")
        void shouldAppendRequiredScopes() {
            var resolver = new ScopeResolver(
                    new TestOAuthConfig().withValidScopes("mail.read").withRequiredScopes("offline", "mail.read"));
            var client = OAuthTestHarness.client("c1", "mail.read");

            assertEquals(List.of("mail.read", "offline"), resolver.resolve(client, OAuthTestHarness.params(null)));
        }
    }
}
