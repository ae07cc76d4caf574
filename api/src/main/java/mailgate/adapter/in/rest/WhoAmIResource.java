package mailgate.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;

import mailgate.core.service.oauth.OAuthRoutes;

/**
 * Lets a client holding an access token inspect what the token grants.
 */
@Path(OAuthRoutes.WHOAMI_PATH)
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

    private final SecurityIdentity identity;

    @Inject
    public WhoAmIResource(SecurityIdentity identity) {
        this.identity = identity;
    }

    /**
     * Return the authenticated client and its granted scopes.
     *
     * @return a map containing client_id, scopes, expires_at and resource (if present)
     */
    @GET
    @Authenticated
    public Map<String, Object> whoami() {
        var result = new LinkedHashMap<String, Object>();
        result.put("client_id", identity.getPrincipal().getName());

        List<String> scopes = identity.getAttribute("scopes");
        result.put("scopes", scopes != null ? scopes : List.of());

        var expiresAt = identity.<Instant>getAttribute("expiresAt");
        if (expiresAt != null) {
            result.put("expires_at", expiresAt.getEpochSecond());
        }
        String resource = identity.getAttribute("resource");
        if (resource != null) {
            result.put("resource", resource);
        }
        return result;
    }
}
