package mailgate.core.model.oauth;

/**
 * Error raised while validating an authorization request (RFC 6749 section 4.1.2.1).
 *
 * <p>When a usable redirect URI is known the error is delivered to the client
 * by redirect; otherwise it must be shown to the user agent directly.
 */
public class AuthorizeException extends RuntimeException {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_SCOPE = "invalid_scope";
    public static final String UNAUTHORIZED_CLIENT = "unauthorized_client";
    public static final String UNSUPPORTED_RESPONSE_TYPE = "unsupported_response_type";

    private final String error;
    private final String redirectUri;
    private final String state;

    private AuthorizeException(String error, String description, String redirectUri, String state) {
        super(description);
        this.error = error;
        this.redirectUri = redirectUri;
        this.state = state;
    }

    /**
     * Error that must not be redirected, such as an unknown client or redirect URI.
     */
    public static AuthorizeException direct(String error, String description) {
        return new AuthorizeException(error, description, null, null);
    }

    /**
     * Error delivered to the client's redirect URI.
     */
    public static AuthorizeException redirect(String error, String description, String redirectUri, String state) {
        return new AuthorizeException(error, description, redirectUri, state);
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return getMessage();
    }

    /**
     * Redirect URI to report the error to, null when the error is not redirectable.
     */
    public String getRedirectUri() {
        return redirectUri;
    }

    public String getState() {
        return state;
    }

    public boolean isRedirectable() {
        return redirectUri != null;
    }
}
