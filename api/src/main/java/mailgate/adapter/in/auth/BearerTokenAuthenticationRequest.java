package mailgate.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying an OAuth access token.
 *
 * <p>Passed from {@link BearerTokenAuthenticationMechanism} to
 * {@link BearerTokenIdentityProvider}.
 */
public class BearerTokenAuthenticationRequest extends BaseAuthenticationRequest {

    private final String token;

    public BearerTokenAuthenticationRequest(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
