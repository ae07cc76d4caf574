package mailgate.core.port.in;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AccessToken;
import mailgate.core.model.oauth.AuthorizationCode;
import mailgate.core.model.oauth.AuthorizationParams;
import mailgate.core.model.oauth.IssuedToken;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.OAuthRoute;
import mailgate.core.model.oauth.RefreshToken;
import mailgate.core.model.oauth.TokenResponse;

/**
 * Authorization server backend driven by the HTTP layer.
 *
 * <p>Covers dynamic client registration, the authorization code grant with an
 * interactive consent step, and refresh token rotation. Request validation
 * (client authentication, PKCE, redirect URI matching) happens in the HTTP
 * layer before these callbacks are invoked.
 */
public interface OAuthAuthorizationProvider {

    /**
     * Look up a registered client.
     */
    Uni<Optional<OAuthClient>> getClient(String clientId);

    /**
     * Register or overwrite a client and persist the registry.
     */
    Uni<Void> registerClient(OAuthClient client);

    /**
     * Start an authorization transaction awaiting operator consent.
     *
     * @return Uni with the consent page URL the user agent is redirected to
     */
    Uni<URI> authorize(OAuthClient client, AuthorizationParams params);

    /**
     * Load an unexpired authorization code issued to {@code client}.
     */
    Uni<Optional<AuthorizationCode>> loadAuthorizationCode(OAuthClient client, String code);

    /**
     * Redeem an authorization code for an access and refresh token pair.
     *
     * <p>Fails with {@code invalid_grant} when the code was already redeemed.
     */
    Uni<TokenResponse> exchangeAuthorizationCode(OAuthClient client, AuthorizationCode code);

    /**
     * Load an unexpired refresh token issued to {@code client}.
     */
    Uni<Optional<RefreshToken>> loadRefreshToken(OAuthClient client, String token);

    /**
     * Rotate a refresh token, issuing a new pair for {@code scopes}.
     *
     * <p>Fails with {@code invalid_scope} when {@code scopes} exceeds the
     * original grant, and with {@code invalid_grant} when the token was
     * already rotated.
     */
    Uni<TokenResponse> exchangeRefreshToken(OAuthClient client, RefreshToken token, List<String> scopes);

    /**
     * Load an unexpired access token. No client binding is applied.
     */
    Uni<Optional<AccessToken>> loadAccessToken(String token);

    /**
     * Revoke an access or refresh token. Revoking an unknown token is a no-op.
     */
    Uni<Void> revokeToken(IssuedToken token);

    /**
     * Routes the HTTP layer exposes for this provider.
     */
    List<OAuthRoute> getRoutes();
}
