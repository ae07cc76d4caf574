package mailgate.core.model.oauth;

/**
 * Client registration rejected (RFC 7591 section 3.2.2).
 */
public class RegistrationException extends RuntimeException {

    public static final String INVALID_CLIENT_METADATA = "invalid_client_metadata";
    public static final String INVALID_REDIRECT_URI = "invalid_redirect_uri";

    private final String error;

    public RegistrationException(String error, String description) {
        super(description);
        this.error = error;
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return getMessage();
    }
}
