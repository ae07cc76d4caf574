package mailgate.core.service.oauth;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.config.OAuthConfig;
import mailgate.core.config.OAuthLifetimes;
import mailgate.core.model.oauth.AccessToken;
import mailgate.core.model.oauth.AuthorizationCode;
import mailgate.core.model.oauth.IssuedToken;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.RefreshToken;
import mailgate.core.model.oauth.TokenException;
import mailgate.core.model.oauth.TokenResponse;
import mailgate.core.port.out.AccessTokenRepository;
import mailgate.core.port.out.AuthorizationCodeRepository;
import mailgate.core.port.out.OAuthMetrics;
import mailgate.core.port.out.RefreshTokenRepository;
import mailgate.core.util.Scopes;
import mailgate.core.util.SecureHash;

/**
 * Exchanges authorization codes and refresh tokens for token pairs.
 *
 * <p>Codes and refresh tokens are removed from their store before a new pair
 * is issued, so each can be redeemed at most once even when two exchanges
 * race. Lookups enforce client binding: a credential issued to another
 * client is reported as not found.
 */
@ApplicationScoped
public class GrantExchanger {

    private static final Logger LOG = Logger.getLogger(GrantExchanger.class);

    private final AuthorizationCodeRepository codeRepository;
    private final AccessTokenRepository accessTokenRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthLifetimes lifetimes;
    private final OAuthMetrics metrics;
    private final Clock clock;

    public GrantExchanger(
            AuthorizationCodeRepository codeRepository,
            AccessTokenRepository accessTokenRepository,
            RefreshTokenRepository refreshTokenRepository,
            SecureTokenGenerator tokenGenerator,
            OAuthConfig config,
            OAuthMetrics metrics,
            Clock clock) {
        this.codeRepository = codeRepository;
        this.accessTokenRepository = accessTokenRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.tokenGenerator = tokenGenerator;
        this.lifetimes = OAuthLifetimes.from(config);
        this.metrics = metrics;
        this.clock = clock;
    }

    public Uni<Optional<AuthorizationCode>> loadAuthorizationCode(OAuthClient client, String code) {
        return codeRepository.findActive(code, client.clientId(), clock.instant());
    }

    public Uni<TokenResponse> exchangeAuthorizationCode(OAuthClient client, AuthorizationCode code) {
        return codeRepository.consume(code.code(), clock.instant()).flatMap(consumed -> {
            if (consumed.isEmpty()) {
                LOG.debugf(
                        "Authorization code %s not found or already used (client %s)",
                        SecureHash.fingerprint(code.code()),
                        client.clientId());
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.invalidGrant("Authorization code not found or already used."));
            }
            final var redeemed = consumed.get();
            return issueTokenPair(client, redeemed.scopes(), redeemed.resource())
                    .invoke(response -> {
                        metrics.recordTokensIssued(OAuthClient.GRANT_AUTHORIZATION_CODE);
                        LOG.infof("Issued tokens for authorization code grant to client %s", client.clientId());
                    });
        });
    }

    public Uni<Optional<RefreshToken>> loadRefreshToken(OAuthClient client, String token) {
        return refreshTokenRepository.findActive(token, client.clientId(), clock.instant());
    }

    public Uni<TokenResponse> exchangeRefreshToken(OAuthClient client, RefreshToken token, List<String> scopes) {
        if (!new HashSet<>(token.scopes()).containsAll(scopes)) {
            return Uni.createFrom()
                    .failure(TokenException.invalidScope(
                            "Requested scopes exceed the scope granted by the refresh token."));
        }
        return refreshTokenRepository.consume(token.token(), clock.instant()).flatMap(consumed -> {
            if (consumed.isEmpty()) {
                LOG.debugf(
                        "Refresh token %s already rotated or expired (client %s)",
                        SecureHash.fingerprint(token.token()),
                        client.clientId());
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.invalidGrant("Refresh token not found or already used."));
            }
            return issueTokenPair(client, scopes, null).invoke(response -> {
                metrics.recordTokensIssued(OAuthClient.GRANT_REFRESH_TOKEN);
                LOG.infof("Rotated refresh token for client %s", client.clientId());
            });
        });
    }

    public Uni<Optional<AccessToken>> loadAccessToken(String token) {
        return accessTokenRepository.findActive(token, clock.instant());
    }

    public Uni<Void> revokeToken(IssuedToken token) {
        final Uni<Boolean> removal;
        if (token instanceof AccessToken) {
            removal = accessTokenRepository.delete(token.token());
        } else {
            removal = refreshTokenRepository.delete(token.token());
        }
        return removal.invoke(removed -> {
                    if (removed) {
                        metrics.recordRevocation();
                        LOG.infof(
                                "Revoked %s %s for client %s",
                                token instanceof AccessToken ? "access token" : "refresh token",
                                SecureHash.fingerprint(token.token()),
                                token.clientId());
                    }
                })
                .replaceWithVoid();
    }

    private Uni<TokenResponse> issueTokenPair(OAuthClient client, List<String> scopes, String resource) {
        final Instant now = clock.instant();
        final var accessToken = new AccessToken(
                tokenGenerator.accessToken(),
                client.clientId(),
                scopes,
                now.plus(lifetimes.accessTokenTtl()),
                resource);
        final var refreshToken = new RefreshToken(
                tokenGenerator.refreshToken(),
                client.clientId(),
                scopes,
                lifetimes.refreshTokenTtl().map(now::plus).orElse(null));

        return accessTokenRepository
                .save(accessToken)
                .flatMap(v -> refreshTokenRepository.save(refreshToken))
                .map(v -> new TokenResponse(
                        accessToken.token(),
                        TokenResponse.BEARER,
                        lifetimes.accessTokenTtl().toSeconds(),
                        refreshToken.token(),
                        Scopes.join(scopes)));
    }
}
