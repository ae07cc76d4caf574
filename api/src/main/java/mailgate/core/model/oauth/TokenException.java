package mailgate.core.model.oauth;

/**
 * OAuth error raised by the token and revocation endpoints (RFC 6749 section 5.2).
 */
public class TokenException extends RuntimeException {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String INVALID_SCOPE = "invalid_scope";
    public static final String UNAUTHORIZED_CLIENT = "unauthorized_client";
    public static final String UNSUPPORTED_GRANT_TYPE = "unsupported_grant_type";

    private final String error;

    public TokenException(String error, String description) {
        super(description);
        this.error = error;
    }

    /**
     * OAuth error code, e.g. {@code invalid_grant}.
     */
    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return getMessage();
    }

    public static TokenException invalidRequest(String description) {
        return new TokenException(INVALID_REQUEST, description);
    }

    public static TokenException invalidClient(String description) {
        return new TokenException(INVALID_CLIENT, description);
    }

    public static TokenException invalidGrant(String description) {
        return new TokenException(INVALID_GRANT, description);
    }

    public static TokenException invalidScope(String description) {
        return new TokenException(INVALID_SCOPE, description);
    }

    public static TokenException unauthorizedClient(String description) {
        return new TokenException(UNAUTHORIZED_CLIENT, description);
    }

    public static TokenException unsupportedGrantType(String description) {
        return new TokenException(UNSUPPORTED_GRANT_TYPE, description);
    }
}
