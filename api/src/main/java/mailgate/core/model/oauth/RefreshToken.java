package mailgate.core.model.oauth;

import java.time.Instant;
import java.util.List;

/**
 * Rotating refresh token. Each successful refresh retires the presented token.
 *
 * @param token     the token value
 * @param clientId  client the token was issued to
 * @param scopes    scopes of the original grant
 * @param expiresAt expiry instant, null when refresh tokens never expire
 */
public record RefreshToken(String token, String clientId, List<String> scopes, Instant expiresAt)
        implements IssuedToken {

    public RefreshToken {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
