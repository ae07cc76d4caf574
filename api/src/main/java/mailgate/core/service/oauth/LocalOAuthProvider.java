package mailgate.core.service.oauth;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.AccessToken;
import mailgate.core.model.oauth.AuthorizationCode;
import mailgate.core.model.oauth.AuthorizationParams;
import mailgate.core.model.oauth.IssuedToken;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.OAuthRoute;
import mailgate.core.model.oauth.PendingAuthorization;
import mailgate.core.model.oauth.RefreshToken;
import mailgate.core.model.oauth.TokenResponse;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.port.out.ClientRepository;
import mailgate.core.port.out.OAuthMetrics;
import mailgate.core.port.out.PendingAuthorizationRepository;

/**
 * Single-operator OAuth 2.1 authorization server backend.
 *
 * <p>Authorization requests are parked as pending transactions until the
 * operator approves or denies them on the consent page, see
 * {@link ConsentService}. Clients are persisted by the {@link ClientRepository};
 * codes and tokens live in memory only.
 */
@ApplicationScoped
public class LocalOAuthProvider implements OAuthAuthorizationProvider {

    private static final Logger LOG = Logger.getLogger(LocalOAuthProvider.class);

    private final ClientRepository clientRepository;
    private final PendingAuthorizationRepository pendingRepository;
    private final ScopeResolver scopeResolver;
    private final GrantExchanger grantExchanger;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthRoutes routes;
    private final OAuthMetrics metrics;
    private final Clock clock;

    public LocalOAuthProvider(
            ClientRepository clientRepository,
            PendingAuthorizationRepository pendingRepository,
            ScopeResolver scopeResolver,
            GrantExchanger grantExchanger,
            SecureTokenGenerator tokenGenerator,
            OAuthRoutes routes,
            OAuthMetrics metrics,
            Clock clock) {
        this.clientRepository = clientRepository;
        this.pendingRepository = pendingRepository;
        this.scopeResolver = scopeResolver;
        this.grantExchanger = grantExchanger;
        this.tokenGenerator = tokenGenerator;
        this.routes = routes;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<Optional<OAuthClient>> getClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return clientRepository.findById(clientId);
    }

    @Override
    public Uni<Void> registerClient(OAuthClient client) {
        return clientRepository.save(client).invoke(() -> {
            metrics.recordClientRegistered();
            LOG.infof("Registered OAuth client %s (%s)", client.clientId(), client.displayName());
        });
    }

    @Override
    public Uni<URI> authorize(OAuthClient client, AuthorizationParams params) {
        final var scopes = scopeResolver.resolve(client, params);
        final var transactionId = tokenGenerator.transactionId();
        final var pending = new PendingAuthorization(client, params, scopes, clock.instant());
        return pendingRepository.save(transactionId, pending).map(v -> {
            LOG.debugf("Created consent transaction %s for client %s", transactionId, client.clientId());
            return URI.create(routes.consentUrl() + "?tx=" + transactionId);
        });
    }

    @Override
    public Uni<Optional<AuthorizationCode>> loadAuthorizationCode(OAuthClient client, String code) {
        return grantExchanger.loadAuthorizationCode(client, code);
    }

    @Override
    public Uni<TokenResponse> exchangeAuthorizationCode(OAuthClient client, AuthorizationCode code) {
        return grantExchanger.exchangeAuthorizationCode(client, code);
    }

    @Override
    public Uni<Optional<RefreshToken>> loadRefreshToken(OAuthClient client, String token) {
        return grantExchanger.loadRefreshToken(client, token);
    }

    @Override
    public Uni<TokenResponse> exchangeRefreshToken(OAuthClient client, RefreshToken token, List<String> scopes) {
        return grantExchanger.exchangeRefreshToken(client, token, scopes);
    }

    @Override
    public Uni<Optional<AccessToken>> loadAccessToken(String token) {
        return grantExchanger.loadAccessToken(token);
    }

    @Override
    public Uni<Void> revokeToken(IssuedToken token) {
        return grantExchanger.revokeToken(token);
    }

    @Override
    public List<OAuthRoute> getRoutes() {
        return routes.routes();
    }
}
