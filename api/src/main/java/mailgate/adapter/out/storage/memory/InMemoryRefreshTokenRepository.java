package mailgate.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.RefreshToken;
import mailgate.core.port.out.RefreshTokenRepository;

/**
 * In-memory store of issued refresh tokens. Lost on restart.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private final ExpiringEntryStore<RefreshToken> tokens = new ExpiringEntryStore<>();

    @Override
    public Uni<Void> save(RefreshToken token) {
        return Uni.createFrom().item(() -> {
            tokens.put(token.token(), token);
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshToken>> findActive(String token, String clientId, Instant now) {
        return Uni.createFrom()
                .item(() -> tokens.find(token, t -> t.clientId().equals(clientId), t -> t.isExpired(now)));
    }

    @Override
    public Uni<Optional<RefreshToken>> consume(String token, Instant now) {
        return Uni.createFrom().item(() -> tokens.take(token, t -> t.isExpired(now)));
    }

    @Override
    public Uni<Boolean> delete(String token) {
        return Uni.createFrom().item(() -> tokens.remove(token).isPresent());
    }

    /**
     * Whether a token is currently stored, expired or not (for testing).
     */
    public boolean contains(String token) {
        return tokens.contains(token);
    }
}
