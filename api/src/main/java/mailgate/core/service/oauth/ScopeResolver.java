package mailgate.core.service.oauth;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import mailgate.core.config.OAuthConfig;
import mailgate.core.model.oauth.AuthorizationParams;
import mailgate.core.model.oauth.OAuthClient;

/**
 * Resolves the scopes an authorization request is granted.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>scopes named in the request, verbatim</li>
 *   <li>otherwise the client's registered scope string</li>
 *   <li>otherwise the server's default scopes</li>
 * </ol>
 * The result is then narrowed to the valid scopes when those are configured,
 * and every required scope is appended if missing. Required scopes are
 * therefore present even when the valid scope filter would drop them.
 */
@ApplicationScoped
public class ScopeResolver {

    private final OAuthConfig config;

    public ScopeResolver(OAuthConfig config) {
        this.config = config;
    }

    public List<String> resolve(OAuthClient client, AuthorizationParams params) {
        List<String> scopes;
        if (params.scopes() != null) {
            scopes = new ArrayList<>(params.scopes());
        } else if (client.scope() != null && !client.scope().isBlank()) {
            scopes = new ArrayList<>(client.registeredScopes());
        } else {
            scopes = new ArrayList<>(config.registration().defaultScopes().orElse(List.of()));
        }

        final var validScopes =
                new HashSet<>(config.registration().validScopes().orElse(List.of()));
        if (!validScopes.isEmpty()) {
            scopes.removeIf(scope -> !validScopes.contains(scope));
        }

        for (String required : config.requiredScopes().orElse(List.of())) {
            if (!scopes.contains(required)) {
                scopes.add(required);
            }
        }
        return List.copyOf(scopes);
    }
}
