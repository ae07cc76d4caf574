package mailgate.core.service.oauth;

import java.net.URI;
import java.util.HashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.AuthorizationParams;
import mailgate.core.model.oauth.AuthorizationRequest;
import mailgate.core.model.oauth.AuthorizeException;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.util.Scopes;

/**
 * Validates authorization endpoint requests and hands them to the provider.
 *
 * <p>Errors about the client or its redirect URI are never redirected, since
 * the redirect target cannot be trusted. Everything else is reported to the
 * client's redirect URI.
 */
@ApplicationScoped
public class AuthorizationRequestService {

    private static final Logger LOG = Logger.getLogger(AuthorizationRequestService.class);

    private final OAuthAuthorizationProvider provider;
    private final PkceVerifier pkceVerifier;

    public AuthorizationRequestService(OAuthAuthorizationProvider provider, PkceVerifier pkceVerifier) {
        this.provider = provider;
        this.pkceVerifier = pkceVerifier;
    }

    /**
     * Validate an authorization request and start a consent transaction.
     *
     * @param request the raw request parameters
     * @return Uni with the consent page URL, failing with {@link AuthorizeException}
     */
    public Uni<URI> authorize(AuthorizationRequest request) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            return Uni.createFrom()
                    .failure(AuthorizeException.direct(AuthorizeException.INVALID_REQUEST, "client_id is required"));
        }
        return provider.getClient(request.clientId()).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom()
                        .<URI>failure(AuthorizeException.direct(
                                AuthorizeException.INVALID_REQUEST,
                                "Client ID '%s' not found".formatted(request.clientId())));
            }
            final var client = found.get();
            final var params = validate(client, request);
            LOG.debugf("Authorization request accepted for client %s", client.clientId());
            return provider.authorize(client, params);
        });
    }

    private AuthorizationParams validate(OAuthClient client, AuthorizationRequest request) {
        final var redirectUri = client.resolveRedirectUri(request.redirectUri())
                .orElseThrow(() -> AuthorizeException.direct(
                        AuthorizeException.INVALID_REQUEST,
                        request.redirectUri() == null
                                ? "redirect_uri must be specified when client has multiple registered URIs"
                                : "Redirect URI '%s' not registered for client".formatted(request.redirectUri())));
        final var state = request.state();

        if (!OAuthClient.RESPONSE_TYPE_CODE.equals(request.responseType())) {
            throw AuthorizeException.redirect(
                    AuthorizeException.UNSUPPORTED_RESPONSE_TYPE, "response_type must be 'code'", redirectUri, state);
        }
        if (!client.supportsGrantType(OAuthClient.GRANT_AUTHORIZATION_CODE)) {
            throw AuthorizeException.redirect(
                    AuthorizeException.UNAUTHORIZED_CLIENT,
                    "Client is not registered for the authorization_code grant",
                    redirectUri,
                    state);
        }
        if (request.codeChallenge() == null || request.codeChallenge().isBlank()) {
            throw AuthorizeException.redirect(
                    AuthorizeException.INVALID_REQUEST, "code_challenge is required", redirectUri, state);
        }
        if (request.codeChallengeMethod() != null && !pkceVerifier.isValidChallengeMethod(request.codeChallengeMethod())) {
            throw AuthorizeException.redirect(
                    AuthorizeException.INVALID_REQUEST,
                    "code_challenge_method must be 'S256'",
                    redirectUri,
                    state);
        }

        final List<String> scopes =
                request.scope() == null || request.scope().isBlank() ? null : Scopes.parse(request.scope());
        if (scopes != null) {
            final var allowed = new HashSet<>(client.registeredScopes());
            for (String scope : scopes) {
                if (!allowed.contains(scope)) {
                    throw AuthorizeException.redirect(
                            AuthorizeException.INVALID_SCOPE,
                            "Client was not registered with scope %s".formatted(scope),
                            redirectUri,
                            state);
                }
            }
        }

        return new AuthorizationParams(
                state,
                scopes,
                request.codeChallenge(),
                redirectUri,
                request.redirectUri() != null,
                request.resource());
    }
}
