package mailgate.core.service.oauth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

import mailgate.core.model.oauth.PendingAuthorization;

/**
 * Renders the operator consent page.
 *
 * <p>Rendering is a pure function of its arguments. Every interpolated value
 * (client name and id, redirect URI, scopes, transaction id, error text) is
 * HTML escaped; client metadata is attacker controlled through registration.
 */
@ApplicationScoped
public class ConsentPageRenderer {

    private static final Escaper HTML = HtmlEscapers.htmlEscaper();
    private static final String NO_SCOPES = "(none)";

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
              <meta charset="utf-8" />
              <meta name="viewport" content="width=device-width, initial-scale=1" />
              <title>Authorize %1$s</title>
              <style>
                body { font-family: system-ui, sans-serif; background: #f4f5f7; color: #1f2933; margin: 0; }
                main { max-width: 30rem; margin: 3rem auto; background: #fff; padding: 2rem;
                       border-radius: 12px; box-shadow: 0 8px 24px rgba(15, 23, 42, 0.12); }
                h1 { font-size: 1.4rem; margin-top: 0; }
                dt { font-weight: 600; }
                dd { margin: 0.25rem 0 1rem 0; word-break: break-all; }
                label { display: block; margin-bottom: 0.4rem; }
                input[type="password"] { width: 100%%; box-sizing: border-box; padding: 0.6rem;
                                         border: 1px solid #cbd5e1; border-radius: 6px; font-size: 1rem; }
                .actions { display: flex; gap: 0.75rem; margin-top: 1.25rem; }
                button { flex: 1; padding: 0.75rem; font-size: 1rem; border: none; border-radius: 8px; cursor: pointer; }
                button.approve { background: #2563eb; color: #fff; }
                button.deny { background: #e2e8f0; color: #1f2933; }
                .error { background: #fee2e2; color: #991b1b; border-radius: 6px; padding: 0.75rem; margin-bottom: 1rem; }
              </style>
            </head>
            <body>
              <main>
                <h1>Authorize %1$s</h1>
                <p>%1$s is requesting access to your mail and calendar.</p>
                <dl>
                  <dt>Client ID</dt>
                  <dd><code>%2$s</code></dd>
                  <dt>Redirect URI</dt>
                  <dd>%3$s</dd>
                  <dt>Requested Scopes</dt>
                  <dd>
                    <ul>
            %4$s        </ul>
                  </dd>
                </dl>
            %5$s    <form method="post">
                  <input type="hidden" name="tx" value="%6$s" />
                  <label for="password">Approval password</label>
                  <input type="password" id="password" name="password" autocomplete="current-password" required />
                  <div class="actions">
                    <button class="approve" type="submit" name="action" value="approve">Allow</button>
                    <button class="deny" type="submit" name="action" value="deny">Deny</button>
                  </div>
                </form>
              </main>
            </body>
            </html>
            """;

    /**
     * Render the consent page.
     *
     * @param transactionId the consent transaction id posted back with the form
     * @param pending       the pending authorization being decided
     * @param error         inline error message, null for none
     * @return the HTML document
     */
    public String render(String transactionId, PendingAuthorization pending, String error) {
        final var client = pending.client();
        final List<String> scopes = pending.scopes().isEmpty() ? List.of(NO_SCOPES) : pending.scopes();

        final var scopeItems = new StringBuilder();
        for (String scope : scopes) {
            scopeItems.append("          <li>").append(HTML.escape(scope)).append("</li>\n");
        }

        final var errorBlock =
                error == null ? "" : "    <div class=\"error\" role=\"alert\">" + HTML.escape(error) + "</div>\n";

        return TEMPLATE.formatted(
                HTML.escape(client.displayName()),
                HTML.escape(client.clientId()),
                HTML.escape(pending.params().redirectUri()),
                scopeItems,
                errorBlock,
                HTML.escape(transactionId));
    }
}
