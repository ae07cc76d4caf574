package mailgate.core.service.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import mailgate.core.util.SecureHash;

/**
 * PKCE (Proof Key for Code Exchange) checks for the authorization code grant.
 *
 * <p>Implements RFC 7636. Only the S256 challenge method is supported as
 * the plain method provides no protection against code interception.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceVerifier {

    public static final String S256_METHOD = "S256";

    /**
     * Validate the challenge method.
     *
     * @param method the code_challenge_method from the request
     * @return true if the method is S256
     */
    public boolean isValidChallengeMethod(String method) {
        return S256_METHOD.equals(method);
    }

    /**
     * Compute the S256 challenge for a verifier: BASE64URL(SHA256(ASCII(verifier))).
     *
     * @param verifier the code verifier
     * @return the base64url encoded challenge without padding
     */
    public String generateChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Check a code verifier against the challenge stored with an authorization code.
     *
     * @param challenge the stored code_challenge
     * @param verifier  the code_verifier from the token request, may be null
     * @return true when the verifier hashes to the challenge
     */
    public boolean verify(String challenge, String verifier) {
        if (verifier == null || verifier.isBlank()) {
            return false;
        }
        return SecureHash.constantTimeEquals(challenge, generateChallenge(verifier));
    }
}
