package mailgate.core.model.oauth;

import java.util.List;

/**
 * Validated parameters of an authorization request.
 *
 * @param state                         opaque client state echoed back on redirect, may be null
 * @param scopes                        explicitly requested scopes, null when the request named none
 * @param codeChallenge                 PKCE S256 code challenge
 * @param redirectUri                   redirect URI the response is sent to
 * @param redirectUriProvidedExplicitly whether the request carried redirect_uri itself
 * @param resource                      RFC 8707 resource indicator, may be null
 */
public record AuthorizationParams(
        String state,
        List<String> scopes,
        String codeChallenge,
        String redirectUri,
        boolean redirectUriProvidedExplicitly,
        String resource) {

    public AuthorizationParams {
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("redirectUri cannot be null or blank");
        }
        if (codeChallenge == null || codeChallenge.isBlank()) {
            throw new IllegalArgumentException("codeChallenge cannot be null or blank");
        }
        scopes = scopes == null ? null : List.copyOf(scopes);
    }
}
