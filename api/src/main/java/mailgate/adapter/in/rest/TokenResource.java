package mailgate.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.TokenRequest;
import mailgate.core.service.oauth.OAuthRoutes;
import mailgate.core.service.oauth.TokenEndpointService;

/**
 * OAuth 2.1 token endpoint for the authorization code and refresh token grants.
 */
@Path(OAuthRoutes.TOKEN_PATH)
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private final TokenEndpointService tokenService;

    @Inject
    public TokenResource(TokenEndpointService tokenService) {
        this.tokenService = tokenService;
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> token(
            @FormParam("grant_type") String grantType,
            @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret,
            @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("code_verifier") String codeVerifier,
            @FormParam("refresh_token") String refreshToken,
            @FormParam("scope") String scope) {
        final var request = new TokenRequest(
                grantType, clientId, clientSecret, code, redirectUri, codeVerifier, refreshToken, scope);
        return tokenService.token(request).map(tokens -> Response.ok(tokens)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .header("Pragma", "no-cache")
                .build());
    }
}
