package mailgate.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AccessToken;
import mailgate.core.port.out.AccessTokenRepository;

/**
 * In-memory store of issued access tokens. Lost on restart.
 */
public class InMemoryAccessTokenRepository implements AccessTokenRepository {

    private final ExpiringEntryStore<AccessToken> tokens = new ExpiringEntryStore<>();

    @Override
    public Uni<Void> save(AccessToken token) {
        return Uni.createFrom().item(() -> {
            tokens.put(token.token(), token);
            return null;
        });
    }

    @Override
    public Uni<Optional<AccessToken>> findActive(String token, Instant now) {
        return Uni.createFrom().item(() -> tokens.find(token, t -> true, t -> t.isExpired(now)));
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
