package mailgate.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import mailgate.adapter.in.dto.ClientRegistrationRequest;
import mailgate.adapter.in.problem.OAuthProblem;
import mailgate.core.service.oauth.ClientRegistrationService;
import mailgate.core.service.oauth.OAuthRoutes;

/**
 * Dynamic client registration endpoint (RFC 7591).
 */
@Path(OAuthRoutes.REGISTER_PATH)
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RegistrationResource {

    private final ClientRegistrationService registrationService;

    @Inject
    public RegistrationResource(ClientRegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    /**
     * Register a client.
     *
     * @param request client metadata
     * @return 201 with the client information, including any issued secret
     */
    @POST
    public Uni<Response> register(ClientRegistrationRequest request) {
        if (!registrationService.isEnabled()) {
            throw OAuthProblem.featureDisabled("Client registration");
        }
        if (request == null) {
            throw OAuthProblem.badRequest("Request body is required");
        }
        return registrationService.register(request.toModel()).map(client -> Response.status(Response.Status.CREATED)
                .entity(client)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .build());
    }
}
