package mailgate.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.RefreshToken;

/**
 * Storage for issued refresh tokens.
 */
public interface RefreshTokenRepository {

    Uni<Void> save(RefreshToken token);

    /**
     * Find an unexpired token issued to {@code clientId}.
     *
     * <p>An expired token is removed by the lookup; tokens without an expiry
     * are never removed here. A token issued to another client is reported as
     * absent and left untouched.
     */
    Uni<Optional<RefreshToken>> findActive(String token, String clientId, Instant now);

    /**
     * Remove a token for rotation.
     *
     * <p>This operation MUST be atomic so that a refresh token can be
     * exchanged at most once.
     *
     * @return Uni with the removed token, empty when it was already gone or expired
     */
    Uni<Optional<RefreshToken>> consume(String token, Instant now);

    /**
     * Delete a token. Deleting an unknown token is a no-op.
     *
     * @return Uni with true if a token was removed
     */
    Uni<Boolean> delete(String token);
}
