package mailgate.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.AuthorizationRequest;
import mailgate.core.service.oauth.AuthorizationRequestService;
import mailgate.core.service.oauth.OAuthRoutes;

/**
 * OAuth 2.1 authorization endpoint.
 *
 * <p>A valid request is redirected to the consent page. Errors are mapped by
 * {@link mailgate.adapter.in.problem.GlobalExceptionMappers}: redirected to
 * the client when its redirect URI is trusted, otherwise answered directly.
 */
@Path(OAuthRoutes.AUTHORIZE_PATH)
public class AuthorizationResource {

    private final AuthorizationRequestService authorizationService;

    @Inject
    public AuthorizationResource(AuthorizationRequestService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GET
    public Uni<Response> authorize(
            @QueryParam("response_type") String responseType,
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("scope") String scope,
            @QueryParam("state") String state,
            @QueryParam("code_challenge") String codeChallenge,
            @QueryParam("code_challenge_method") String codeChallengeMethod,
            @QueryParam("resource") String resource) {
        return handle(new AuthorizationRequest(
                responseType, clientId, redirectUri, scope, state, codeChallenge, codeChallengeMethod, resource));
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> authorizeForm(
            @FormParam("response_type") String responseType,
            @FormParam("client_id") String clientId,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("scope") String scope,
            @FormParam("state") String state,
            @FormParam("code_challenge") String codeChallenge,
            @FormParam("code_challenge_method") String codeChallengeMethod,
            @FormParam("resource") String resource) {
        return handle(new AuthorizationRequest(
                responseType, clientId, redirectUri, scope, state, codeChallenge, codeChallengeMethod, resource));
    }

    private Uni<Response> handle(AuthorizationRequest request) {
        return authorizationService.authorize(request).map(consentUrl -> Response.status(Response.Status.FOUND)
                .location(consentUrl)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .build());
    }
}
