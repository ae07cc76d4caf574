package mailgate.core.service.oauth;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates unguessable identifiers and credentials.
 *
 * <p>All values come from {@link SecureRandom} and are URL-safe base64 encoded
 * without padding unless noted otherwise.
 */
@ApplicationScoped
public class SecureTokenGenerator {

    static final int TRANSACTION_ID_BYTES = 32;
    static final int AUTHORIZATION_CODE_BYTES = 32;
    static final int TOKEN_BYTES = 48;
    static final int CLIENT_SECRET_BYTES = 32;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Consent transaction id.
     */
    public String transactionId() {
        return urlSafe(TRANSACTION_ID_BYTES);
    }

    public String authorizationCode() {
        return urlSafe(AUTHORIZATION_CODE_BYTES);
    }

    public String accessToken() {
        return urlSafe(TOKEN_BYTES);
    }

    public String refreshToken() {
        return urlSafe(TOKEN_BYTES);
    }

    /**
     * Client secret, hex encoded.
     */
    public String clientSecret() {
        final var bytes = new byte[CLIENT_SECRET_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public String clientId() {
        return UUID.randomUUID().toString();
    }

    private static String urlSafe(int length) {
        final var bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
