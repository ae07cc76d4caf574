package mailgate.adapter.in.problem;

import java.util.LinkedHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import mailgate.adapter.in.dto.OAuthErrorResponse;
import mailgate.core.model.oauth.AuthorizeException;
import mailgate.core.model.oauth.ClientStoreException;
import mailgate.core.model.oauth.RegistrationException;
import mailgate.core.model.oauth.TokenException;
import mailgate.core.util.RedirectUris;

/**
 * Global exception mappers for the authorization server endpoints.
 *
 * <p>OAuth errors are rendered in the RFC 6749 wire format; everything else
 * becomes an RFC 7807 problem.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    private static final String NO_STORE = "no-store";

    @ServerExceptionMapper
    public Response mapTokenException(TokenException e) {
        LOG.debugv("Token request rejected: {0} ({1})", e.getError(), e.getMessage());
        final var status = TokenException.INVALID_CLIENT.equals(e.getError())
                ? Response.Status.UNAUTHORIZED
                : Response.Status.BAD_REQUEST;
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CACHE_CONTROL, NO_STORE)
                .header("Pragma", "no-cache")
                .entity(new OAuthErrorResponse(e.getError(), e.getErrorDescription()))
                .build();
    }

    @ServerExceptionMapper
    public Response mapAuthorizeException(AuthorizeException e) {
        LOG.debugv("Authorization request rejected: {0} ({1})", e.getError(), e.getMessage());
        if (!e.isRedirectable()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(new OAuthErrorResponse(e.getError(), e.getErrorDescription()))
                    .build();
        }
        final var params = new LinkedHashMap<String, String>();
        params.put("error", e.getError());
        params.put("error_description", e.getErrorDescription());
        params.put("state", e.getState());
        return Response.status(Response.Status.FOUND)
                .location(RedirectUris.withParameters(e.getRedirectUri(), params))
                .header(HttpHeaders.CACHE_CONTROL, NO_STORE)
                .build();
    }

    @ServerExceptionMapper
    public Response mapRegistrationException(RegistrationException e) {
        LOG.debugv("Client registration rejected: {0} ({1})", e.getError(), e.getMessage());
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(new OAuthErrorResponse(e.getError(), e.getErrorDescription()))
                .build();
    }

    @ServerExceptionMapper
    public Response mapClientStoreException(ClientStoreException e) {
        LOG.errorv(e, "Client registration could not be persisted: {0}", e.getMessage());
        return toResponse(OAuthProblem.internalError("Client registration could not be persisted"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(OAuthProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
