package mailgate.core.model.oauth;

import java.time.Instant;
import java.util.List;

/**
 * Access token presented as a bearer credential to protected resources.
 *
 * @param token     the token value
 * @param clientId  client the token was issued to
 * @param scopes    granted scopes
 * @param expiresAt expiry instant
 * @param resource  RFC 8707 resource indicator, may be null
 */
public record AccessToken(String token, String clientId, List<String> scopes, Instant expiresAt, String resource)
        implements IssuedToken {

    public AccessToken {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
