package mailgate.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AuthorizationCode;

/**
 * Storage for issued, unredeemed authorization codes.
 */
public interface AuthorizationCodeRepository {

    Uni<Void> save(AuthorizationCode code);

    /**
     * Find an unexpired code issued to {@code clientId}.
     *
     * <p>An expired code is removed by the lookup. A code issued to another
     * client is reported as absent and left untouched.
     */
    Uni<Optional<AuthorizationCode>> findActive(String code, String clientId, Instant now);

    /**
     * Remove a code for redemption (one-time use).
     *
     * <p>This operation MUST be atomic: if the code exists it is returned and
     * deleted, so two concurrent redemptions cannot both succeed.
     *
     * @return Uni with the code, empty when unknown, already redeemed or expired
     */
    Uni<Optional<AuthorizationCode>> consume(String code, Instant now);
}
