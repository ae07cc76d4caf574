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

import mailgate.core.model.oauth.ConsentResult;
import mailgate.core.port.in.ConsentManagement;
import mailgate.core.service.oauth.OAuthRoutes;

/**
 * Operator consent page.
 *
 * <p>{@code GET} renders the form for a pending transaction; {@code POST}
 * submits the password and the approve/deny decision. The transaction id may
 * arrive in the query string or in the form body.
 */
@Path(OAuthRoutes.CONSENT_PATH)
public class ConsentResource {

    private static final String NO_STORE = "no-store";

    private final ConsentManagement consentManagement;

    @Inject
    public ConsentResource(ConsentManagement consentManagement) {
        this.consentManagement = consentManagement;
    }

    @GET
    public Uni<Response> show(@QueryParam("tx") String transactionId) {
        return consentManagement.showConsent(transactionId).map(ConsentResource::toResponse);
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> submit(
            @QueryParam("tx") String queryTransactionId,
            @FormParam("tx") String formTransactionId,
            @FormParam("password") String password,
            @FormParam("action") String action) {
        final var transactionId =
                queryTransactionId != null && !queryTransactionId.isBlank() ? queryTransactionId : formTransactionId;
        return consentManagement
                .submitConsent(transactionId, password == null ? "" : password, action)
                .map(ConsentResource::toResponse);
    }

    static Response toResponse(ConsentResult result) {
        if (result instanceof ConsentResult.Redirect redirect) {
            return Response.status(Response.Status.FOUND)
                    .location(redirect.location())
                    .header(HttpHeaders.CACHE_CONTROL, NO_STORE)
                    .build();
        }
        if (result instanceof ConsentResult.Page page) {
            return Response.ok(page.html(), MediaType.TEXT_HTML_TYPE.withCharset("utf-8"))
                    .header(HttpHeaders.CACHE_CONTROL, NO_STORE)
                    .build();
        }
        final var rejected = (ConsentResult.Rejected) result;
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.TEXT_PLAIN_TYPE.withCharset("utf-8"))
                .entity(rejected.message())
                .build();
    }
}
