package mailgate.core.model.oauth;

import java.net.URI;

/**
 * Outcome of a consent page request.
 */
public sealed interface ConsentResult {

    /**
     * Render the consent page (HTTP 200).
     *
     * @param html the rendered page
     */
    record Page(String html) implements ConsentResult {}

    /**
     * Send the user agent back to the client (HTTP 302, not cacheable).
     *
     * @param location redirect target carrying either a code or an error
     */
    record Redirect(URI location) implements ConsentResult {}

    /**
     * The transaction is missing, unknown or expired (HTTP 400, plain text).
     *
     * @param message message telling the user to restart the flow
     */
    record Rejected(String message) implements ConsentResult {}
}
