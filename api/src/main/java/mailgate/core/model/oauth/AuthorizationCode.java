package mailgate.core.model.oauth;

import java.time.Instant;
import java.util.List;

/**
 * Single-use authorization code minted on consent approval.
 *
 * @param code                          the code value
 * @param clientId                      client the code was issued to
 * @param scopes                        granted scopes
 * @param expiresAt                     expiry instant
 * @param codeChallenge                 PKCE S256 challenge from the authorization request
 * @param redirectUri                   redirect URI the code was delivered to
 * @param redirectUriProvidedExplicitly whether the token request must repeat the redirect URI
 * @param resource                      RFC 8707 resource indicator, may be null
 */
public record AuthorizationCode(
        String code,
        String clientId,
        List<String> scopes,
        Instant expiresAt,
        String codeChallenge,
        String redirectUri,
        boolean redirectUriProvidedExplicitly,
        String resource) {

    public AuthorizationCode {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
