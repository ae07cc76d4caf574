package mailgate.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.PendingAuthorization;
import mailgate.core.port.out.PendingAuthorizationRepository;

/**
 * In-memory store of consent transactions. Lost on restart.
 */
public class InMemoryPendingAuthorizationRepository implements PendingAuthorizationRepository {

    private final ExpiringEntryStore<PendingAuthorization> entries = new ExpiringEntryStore<>();

    @Override
    public Uni<Void> save(String transactionId, PendingAuthorization pending) {
        return Uni.createFrom().item(() -> {
            entries.put(transactionId, pending);
            return null;
        });
    }

    @Override
    public Uni<Optional<PendingAuthorization>> findActive(String transactionId, Instant now, Duration ttl) {
        return Uni.createFrom()
                .item(() -> entries.find(transactionId, pending -> true, pending -> pending.isExpired(now, ttl)));
    }

    @Override
    public Uni<Optional<PendingAuthorization>> remove(String transactionId) {
        return Uni.createFrom().item(() -> entries.remove(transactionId));
    }

    /**
     * Whether a transaction is currently stored, expired or not (for testing).
     */
    public boolean contains(String transactionId) {
        return entries.contains(transactionId);
    }

    /**
     * Get the current count of stored transactions (for testing).
     */
    public int size() {
        return entries.size();
    }
}
