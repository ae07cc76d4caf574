package mailgate.core.model.oauth;

import java.util.Set;

/**
 * An HTTP route exposed by the authorization provider.
 *
 * @param path    route path relative to the server root
 * @param methods accepted HTTP methods
 * @param name    short route name used in logs and metadata
 */
public record OAuthRoute(String path, Set<String> methods, String name) {

    public OAuthRoute {
        methods = Set.copyOf(methods);
    }
}
