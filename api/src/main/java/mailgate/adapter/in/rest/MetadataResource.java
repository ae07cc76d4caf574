package mailgate.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import mailgate.core.model.oauth.AuthorizationServerMetadata;
import mailgate.core.service.oauth.OAuthRoutes;

/**
 * Authorization server metadata (RFC 8414).
 */
@Path(OAuthRoutes.METADATA_PATH)
@Produces(MediaType.APPLICATION_JSON)
public class MetadataResource {

    private final OAuthRoutes routes;

    @Inject
    public MetadataResource(OAuthRoutes routes) {
        this.routes = routes;
    }

    @GET
    public AuthorizationServerMetadata metadata() {
        return routes.metadata();
    }
}
