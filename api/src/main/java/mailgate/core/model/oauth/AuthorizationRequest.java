package mailgate.core.model.oauth;

/**
 * Raw authorization endpoint parameters (RFC 6749 section 4.1.1, RFC 7636, RFC 8707).
 *
 * <p>Values are unvalidated and may be null.
 */
public record AuthorizationRequest(
        String responseType,
        String clientId,
        String redirectUri,
        String scope,
        String state,
        String codeChallenge,
        String codeChallengeMethod,
        String resource) {}
