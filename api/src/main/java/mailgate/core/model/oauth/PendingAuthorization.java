package mailgate.core.model.oauth;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * An authorization request waiting for the operator's consent decision.
 *
 * @param client    the requesting client
 * @param params    the original authorization parameters
 * @param scopes    the resolved scopes shown on the consent page
 * @param createdAt when the request was received
 */
public record PendingAuthorization(
        OAuthClient client, AuthorizationParams params, List<String> scopes, Instant createdAt) {

    public PendingAuthorization {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    /**
     * Whether more than {@code ttl} has elapsed since creation.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return now.isAfter(createdAt.plus(ttl));
    }
}
