package mailgate.core.service.oauth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.TokenException;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.util.SecureHash;

/**
 * Authenticates clients at the token and revocation endpoints using
 * {@code client_secret_post}.
 *
 * <p>Public clients (registered with {@code token_endpoint_auth_method=none})
 * authenticate with their client id alone.
 */
@ApplicationScoped
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    private final OAuthAuthorizationProvider provider;
    private final Clock clock;

    public ClientAuthenticator(OAuthAuthorizationProvider provider, Clock clock) {
        this.provider = provider;
        this.clock = clock;
    }

    /**
     * Resolve and authenticate a client.
     *
     * @param clientId     the client_id form parameter
     * @param clientSecret the client_secret form parameter, may be null
     * @return Uni with the client, failing with {@code invalid_client}
     */
    public Uni<OAuthClient> authenticate(String clientId, String clientSecret) {
        if (clientId == null || clientId.isBlank()) {
            return Uni.createFrom().failure(TokenException.invalidClient("Missing client_id"));
        }
        return provider.getClient(clientId).map(found -> {
            final var client = found.orElseThrow(() -> TokenException.invalidClient("Invalid client_id"));
            if (client.isPublic()) {
                return client;
            }
            if (clientSecret == null) {
                throw TokenException.invalidClient("Client secret is required");
            }
            if (!SecureHash.constantTimeEquals(client.clientSecret(), clientSecret)) {
                LOG.debugf("Invalid client secret presented for client %s", clientId);
                throw TokenException.invalidClient("Invalid client_secret");
            }
            if (isSecretExpired(client)) {
                throw TokenException.invalidClient("Client secret has expired");
            }
            return client;
        });
    }

    private boolean isSecretExpired(OAuthClient client) {
        final var expiresAt = client.clientSecretExpiresAt();
        return expiresAt != null && expiresAt > 0 && expiresAt < clock.instant().getEpochSecond();
    }
}
