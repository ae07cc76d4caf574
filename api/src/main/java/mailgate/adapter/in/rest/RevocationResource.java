package mailgate.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import mailgate.adapter.in.problem.OAuthProblem;
import mailgate.core.service.oauth.OAuthRoutes;
import mailgate.core.service.oauth.RevocationService;

/**
 * Token revocation endpoint (RFC 7009).
 *
 * <p>Answers 200 whether or not the token existed.
 */
@Path(OAuthRoutes.REVOKE_PATH)
public class RevocationResource {

    private final RevocationService revocationService;

    @Inject
    public RevocationResource(RevocationService revocationService) {
        this.revocationService = revocationService;
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> revoke(
            @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret,
            @FormParam("token") String token,
            @FormParam("token_type_hint") String tokenTypeHint) {
        if (!revocationService.isEnabled()) {
            throw OAuthProblem.featureDisabled("Token revocation");
        }
        return revocationService
                .revoke(clientId, clientSecret, token, tokenTypeHint)
                .map(v -> Response.ok().build());
    }
}
