package mailgate.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.PendingAuthorization;

@DisplayName("ConsentPageRenderer")
class ConsentPageRendererTest {

    private final ConsentPageRenderer renderer = new ConsentPageRenderer();

    private static PendingAuthorization pending(OAuthClient client, List<String> scopes) {
        return new PendingAuthorization(client, OAuthTestHarness.params(scopes), scopes, Instant.EPOCH);
    }

    @Test
    @DisplayName("should show client, redirect URI, scopes and the transaction id")
    void shouldRenderDetails() {
        var client = OAuthTestHarness.client("client-1", "mail.read");

        String html = renderer.render("tx-123", pending(client, List.of("mail.read", "mail.send")), null);

        assertTrue(html.contains("Authorize Client client-1"));
        assertTrue(html.contains("<code>client-1</code>"));
        assertTrue(html.contains("https://cb/"));
        assertTrue(html.contains("<li>mail.read</li>"));
        assertTrue(html.contains("<li>mail.send</li>"));
        assertTrue(html.contains("name=\"tx\" value=\"tx-123\""));
        assertTrue(html.contains("value=\"approve\""));
        assertTrue(html.contains("value=\"deny\""));
        assertFalse(html.contains("role=\"alert\""));
    }

    @Test
    @DisplayName("should post the form back to the URL it was served from")
    void shouldPostBackToPageUrl() {
        String html = renderer.render("tx-123", pending(OAuthTestHarness.client("c1", null), List.of()), null);

        assertTrue(html.contains("<form method=\"post\">"));
        assertFalse(html.contains("action="));
    }

    @Test
    @DisplayName("should show (none) when no scopes were resolved")
    void shouldShowNoneForEmptyScopes() {
        var client = OAuthTestHarness.client("client-1", null);

        String html = renderer.render("tx", pending(client, List.of()), null);

        assertTrue(html.contains("<li>(none)</li>"));
    }

    @Test
    @DisplayName("should escape attacker controlled values")
    void shouldEscapeValues() {
        var hostile = new OAuthClient(
                "client-1",
                null,
                1L,
                null,
                "<script>alert('x')</script>",
                List.of("https://cb/"),
                null,
                null,
                null,
                "none",
                null,
                null,
                null,
                null,
                null);

        String html = renderer.render("\"><b>tx", pending(hostile, List.of("<i>scope</i>")), "<oops>");

        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("&lt;script&gt;alert(&#39;x&#39;)&lt;/script&gt;"));
        assertTrue(html.contains("&lt;i&gt;scope&lt;/i&gt;"));
        assertTrue(html.contains("value=\"&quot;&gt;&lt;b&gt;tx\""));
        assertTrue(html.contains("&lt;oops&gt;"));
    }

    @Test
    @DisplayName("should render the error message inline")
    void shouldRenderError() {
        var client = OAuthTestHarness.client("client-1", "mail.read");

        String html = renderer.render("tx", pending(client, List.of("mail.read")), "Incorrect authorization password.");

        assertTrue(html.contains("role=\"alert\""));
        assertTrue(html.contains("Incorrect authorization password."));
    }
}
