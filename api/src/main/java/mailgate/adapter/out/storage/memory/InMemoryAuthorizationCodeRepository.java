package mailgate.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AuthorizationCode;
import mailgate.core.port.out.AuthorizationCodeRepository;

/**
 * In-memory store of unredeemed authorization codes. Lost on restart.
 */
public class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

    private final ExpiringEntryStore<AuthorizationCode> codes = new ExpiringEntryStore<>();

    @Override
    public Uni<Void> save(AuthorizationCode code) {
        return Uni.createFrom().item(() -> {
            codes.put(code.code(), code);
            return null;
        });
    }

    @Override
    public Uni<Optional<AuthorizationCode>> findActive(String code, String clientId, Instant now) {
        return Uni.createFrom()
                .item(() -> codes.find(code, c -> c.clientId().equals(clientId), c -> c.isExpired(now)));
    }

    @Override
    public Uni<Optional<AuthorizationCode>> consume(String code, Instant now) {
        return Uni.createFrom().item(() -> codes.take(code, c -> c.isExpired(now)));
    }

    /**
     * Whether a code is currently stored, expired or not (for testing).
     */
    public boolean contains(String code) {
        return codes.contains(code);
    }
}
