package mailgate.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AccessToken;

/**
 * Storage for issued access tokens.
 */
public interface AccessTokenRepository {

    Uni<Void> save(AccessToken token);

    /**
     * Find an unexpired token. An expired token is removed by the lookup.
     */
    Uni<Optional<AccessToken>> findActive(String token, Instant now);

    /**
     * Delete a token. Deleting an unknown token is a no-op.
     *
     * @return Uni with true if a token was removed
     */
    Uni<Boolean> delete(String token);
}
