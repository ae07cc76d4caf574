package mailgate.core.service.oauth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.TokenException;
import mailgate.core.model.oauth.TokenRequest;
import mailgate.core.model.oauth.TokenResponse;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.port.out.OAuthMetrics;
import mailgate.core.util.Scopes;

/**
 * Token endpoint: authenticates the client, validates the grant and delegates
 * the exchange to the provider.
 */
@ApplicationScoped
public class TokenEndpointService {

    private static final Logger LOG = Logger.getLogger(TokenEndpointService.class);

    private final OAuthAuthorizationProvider provider;
    private final ClientAuthenticator authenticator;
    private final PkceVerifier pkceVerifier;
    private final OAuthMetrics metrics;

    public TokenEndpointService(
            OAuthAuthorizationProvider provider,
            ClientAuthenticator authenticator,
            PkceVerifier pkceVerifier,
            OAuthMetrics metrics) {
        this.provider = provider;
        this.authenticator = authenticator;
        this.pkceVerifier = pkceVerifier;
        this.metrics = metrics;
    }

    /**
     * Handle a token request.
     *
     * @param request the form parameters
     * @return Uni with the issued tokens, failing with {@link TokenException}
     */
    public Uni<TokenResponse> token(TokenRequest request) {
        return dispatch(request).onFailure(TokenException.class).invoke(failure -> {
            final var error = ((TokenException) failure).getError();
            metrics.recordGrantFailure(error);
            LOG.debugf("Token request failed for client %s: %s", request.clientId(), error);
        });
    }

    private Uni<TokenResponse> dispatch(TokenRequest request) {
        final var grantType = request.grantType();
        if (grantType == null || grantType.isBlank()) {
            return Uni.createFrom().failure(TokenException.invalidRequest("grant_type is required"));
        }
        if (!OAuthClient.GRANT_AUTHORIZATION_CODE.equals(grantType)
                && !OAuthClient.GRANT_REFRESH_TOKEN.equals(grantType)) {
            return Uni.createFrom()
                    .failure(TokenException.unsupportedGrantType(
                            "Unsupported grant type '%s'".formatted(grantType)));
        }

        return authenticator.authenticate(request.clientId(), request.clientSecret()).flatMap(client -> {
            if (!client.supportsGrantType(grantType)) {
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.unauthorizedClient(
                                "Client is not registered for the %s grant".formatted(grantType)));
            }
            return OAuthClient.GRANT_AUTHORIZATION_CODE.equals(grantType)
                    ? authorizationCodeGrant(client, request)
                    : refreshTokenGrant(client, request);
        });
    }

    private Uni<TokenResponse> authorizationCodeGrant(OAuthClient client, TokenRequest request) {
        if (request.code() == null || request.code().isBlank()) {
            return Uni.createFrom().failure(TokenException.invalidRequest("code is required"));
        }
        if (request.codeVerifier() == null || request.codeVerifier().isBlank()) {
            return Uni.createFrom().failure(TokenException.invalidRequest("code_verifier is required"));
        }
        return provider.loadAuthorizationCode(client, request.code()).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.invalidGrant("authorization code does not exist"));
            }
            final var code = found.get();
            if (code.redirectUriProvidedExplicitly() && !code.redirectUri().equals(request.redirectUri())) {
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.invalidGrant(
                                "redirect_uri did not match the one used when creating auth code"));
            }
            if (!pkceVerifier.verify(code.codeChallenge(), request.codeVerifier())) {
                return Uni.createFrom().<TokenResponse>failure(TokenException.invalidGrant("incorrect code_verifier"));
            }
            return provider.exchangeAuthorizationCode(client, code);
        });
    }

    private Uni<TokenResponse> refreshTokenGrant(OAuthClient client, TokenRequest request) {
        if (request.refreshToken() == null || request.refreshToken().isBlank()) {
            return Uni.createFrom().failure(TokenException.invalidRequest("refresh_token is required"));
        }
        return provider.loadRefreshToken(client, request.refreshToken()).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom()
                        .<TokenResponse>failure(TokenException.invalidGrant("refresh token does not exist"));
            }
            final var token = found.get();
            final List<String> scopes = request.scope() == null || request.scope().isBlank()
                    ? token.scopes()
                    : Scopes.parse(request.scope());
            return provider.exchangeRefreshToken(client, token, scopes);
        });
    }
}
