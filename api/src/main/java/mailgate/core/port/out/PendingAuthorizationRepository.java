package mailgate.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.PendingAuthorization;

/**
 * Storage for authorization requests awaiting consent.
 *
 * <p>Entries are never swept in the background. An entry found to be older
 * than the TTL on lookup MUST be removed by that lookup.
 */
public interface PendingAuthorizationRepository {

    /**
     * Store a pending authorization under its transaction id.
     */
    Uni<Void> save(String transactionId, PendingAuthorization pending);

    /**
     * Find a pending authorization that has not outlived {@code ttl}.
     *
     * @param transactionId the transaction id
     * @param now           current time
     * @param ttl           maximum age of a pending authorization
     * @return Uni with the entry, empty when unknown or expired (expired entries are removed)
     */
    Uni<Optional<PendingAuthorization>> findActive(String transactionId, Instant now, Duration ttl);

    /**
     * Remove a pending authorization.
     *
     * <p>This operation MUST be atomic: of two concurrent calls for the same id
     * at most one receives the entry.
     *
     * @return Uni with the removed entry, empty when it was already gone
     */
    Uni<Optional<PendingAuthorization>> remove(String transactionId);
}
