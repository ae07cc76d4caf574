package mailgate.adapter.in.auth;

import java.security.Principal;
import java.util.HashSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.AccessToken;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.util.SecureHash;

/**
 * Validates access tokens against the token store and builds the caller's identity.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal: {@link ClientPrincipal} named after the client id</li>
 *   <li>Roles: the granted scopes</li>
 *   <li>Attributes: scopes, expiresAt, and resource when present</li>
 * </ul>
 */
@ApplicationScoped
public class BearerTokenIdentityProvider implements IdentityProvider<BearerTokenAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(BearerTokenIdentityProvider.class);

    private final OAuthAuthorizationProvider provider;

    @Inject
    public BearerTokenIdentityProvider(OAuthAuthorizationProvider provider) {
        this.provider = provider;
    }

    @Override
    public Class<BearerTokenAuthenticationRequest> getRequestType() {
        return BearerTokenAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BearerTokenAuthenticationRequest request, AuthenticationRequestContext context) {
        return provider.loadAccessToken(request.getToken()).map(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Rejected unknown or expired access token %s", SecureHash.fingerprint(request.getToken()));
                throw new AuthenticationFailedException("Invalid or expired access token");
            }
            return buildIdentity(found.get());
        });
    }

    private SecurityIdentity buildIdentity(AccessToken token) {
        var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(new ClientPrincipal(token.clientId()))
                .addRoles(new HashSet<>(token.scopes()))
                .addAttribute("scopes", token.scopes())
                .addAttribute("expiresAt", token.expiresAt());
        if (token.resource() != null) {
            builder.addAttribute("resource", token.resource());
        }
        return builder.build();
    }

    /**
     * Principal representing an OAuth client holding a valid access token.
     */
    public static class ClientPrincipal implements Principal {
        private final String clientId;

        public ClientPrincipal(String clientId) {
            this.clientId = clientId;
        }

        @Override
        public String getName() {
            return clientId;
        }
    }
}
