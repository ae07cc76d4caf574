package mailgate.core.service.oauth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.config.OAuthConfig;
import mailgate.core.model.oauth.IssuedToken;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.TokenException;
import mailgate.core.port.in.OAuthAuthorizationProvider;

/**
 * Token revocation (RFC 7009).
 *
 * <p>Unknown tokens and tokens issued to another client are silently
 * ignored, so the caller cannot probe for token existence.
 */
@ApplicationScoped
public class RevocationService {

    private static final Logger LOG = Logger.getLogger(RevocationService.class);

    private final OAuthAuthorizationProvider provider;
    private final ClientAuthenticator authenticator;
    private final OAuthConfig config;

    public RevocationService(
            OAuthAuthorizationProvider provider, ClientAuthenticator authenticator, OAuthConfig config) {
        this.provider = provider;
        this.authenticator = authenticator;
        this.config = config;
    }

    public boolean isEnabled() {
        return config.revocation().enabled();
    }

    /**
     * Revoke an access or refresh token owned by the authenticated client.
     *
     * @param clientId      the client_id form parameter
     * @param clientSecret  the client_secret form parameter
     * @param token         the token to revoke
     * @param tokenTypeHint {@code access_token} or {@code refresh_token}, may be null
     * @return Uni completing once the token is gone
     */
    public Uni<Void> revoke(String clientId, String clientSecret, String token, String tokenTypeHint) {
        return authenticator.authenticate(clientId, clientSecret).flatMap(client -> {
            if (token == null || token.isBlank()) {
                return Uni.createFrom().<Void>failure(TokenException.invalidRequest("token is required"));
            }
            return find(client, token, tokenTypeHint).flatMap(found -> {
                if (found.isEmpty()) {
                    LOG.debugf("Revocation request from client %s matched no token", client.clientId());
                    return Uni.createFrom().voidItem();
                }
                return provider.revokeToken(found.get());
            });
        });
    }

    private Uni<Optional<IssuedToken>> find(OAuthClient client, String token, String tokenTypeHint) {
        final Uni<Optional<IssuedToken>> access = provider.loadAccessToken(token)
                .map(found -> found.filter(t -> t.clientId().equals(client.clientId())).<IssuedToken>map(t -> t));
        final Uni<Optional<IssuedToken>> refresh =
                provider.loadRefreshToken(client, token).map(found -> found.<IssuedToken>map(t -> t));

        if ("refresh_token".equals(tokenTypeHint)) {
            return refresh.<Optional<IssuedToken>>flatMap(
                    found -> found.isPresent() ? Uni.createFrom().item(found) : access);
        }
        return access.<Optional<IssuedToken>>flatMap(
                found -> found.isPresent() ? Uni.createFrom().item(found) : refresh);
    }
}
