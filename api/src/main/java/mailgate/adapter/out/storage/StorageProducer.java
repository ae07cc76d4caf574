package mailgate.adapter.out.storage;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;

import mailgate.adapter.out.storage.file.JsonFileClientRepository;
import mailgate.adapter.out.storage.memory.InMemoryAccessTokenRepository;
import mailgate.adapter.out.storage.memory.InMemoryAuthorizationCodeRepository;
import mailgate.adapter.out.storage.memory.InMemoryPendingAuthorizationRepository;
import mailgate.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import mailgate.core.config.OAuthConfig;
import mailgate.core.port.out.AccessTokenRepository;
import mailgate.core.port.out.AuthorizationCodeRepository;
import mailgate.core.port.out.ClientRepository;
import mailgate.core.port.out.PendingAuthorizationRepository;
import mailgate.core.port.out.RefreshTokenRepository;

/**
 * CDI producers for the authorization server stores.
 *
 * <p>Clients are persisted to the JSON file at
 * {@code mailgate.oauth.client-store-path}. Consent transactions, codes and
 * tokens are held in memory and do not survive a restart.
 */
@ApplicationScoped
public class StorageProducer {

    private final OAuthConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public StorageProducer(OAuthConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public ClientRepository clientRepository() {
        return new JsonFileClientRepository(objectMapper, Path.of(config.clientStorePath()));
    }

    @Produces
    @ApplicationScoped
    public PendingAuthorizationRepository pendingAuthorizationRepository() {
        return new InMemoryPendingAuthorizationRepository();
    }

    @Produces
    @ApplicationScoped
    public AuthorizationCodeRepository authorizationCodeRepository() {
        return new InMemoryAuthorizationCodeRepository();
    }

    @Produces
    @ApplicationScoped
    public AccessTokenRepository accessTokenRepository() {
        return new InMemoryAccessTokenRepository();
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenRepository refreshTokenRepository() {
        return new InMemoryRefreshTokenRepository();
    }
}
