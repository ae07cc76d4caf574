package mailgate.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.OAuthClient;

/**
 * Storage for registered OAuth clients.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Registrations MUST survive a restart</li>
 *   <li>Concurrent saves MUST NOT lose updates or interleave partial writes</li>
 *   <li>A failed write MUST fail the returned Uni</li>
 * </ul>
 */
public interface ClientRepository {

    /**
     * Look up a client by id.
     *
     * @param clientId the client id
     * @return Uni with the client if registered
     */
    Uni<Optional<OAuthClient>> findById(String clientId);

    /**
     * Insert or overwrite a client and persist the registry.
     *
     * @param client the client to store
     * @return Uni completing once the client is durably stored
     */
    Uni<Void> save(OAuthClient client);
}
