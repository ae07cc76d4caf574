package mailgate.core.model.oauth;

/**
 * Raw token endpoint parameters for the authorization code and refresh token grants.
 *
 * <p>Values are unvalidated and may be null.
 */
public record TokenRequest(
        String grantType,
        String clientId,
        String clientSecret,
        String code,
        String redirectUri,
        String codeVerifier,
        String refreshToken,
        String scope) {}
