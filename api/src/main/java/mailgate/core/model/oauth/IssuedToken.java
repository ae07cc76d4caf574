package mailgate.core.model.oauth;

import java.time.Instant;
import java.util.List;

/**
 * A bearer credential issued by the token endpoint.
 */
public sealed interface IssuedToken permits AccessToken, RefreshToken {

    String token();

    String clientId();

    List<String> scopes();

    /**
     * Expiry instant, null when the token never expires.
     */
    Instant expiresAt();

    default boolean isExpired(Instant now) {
        return expiresAt() != null && now.isAfter(expiresAt());
    }
}
