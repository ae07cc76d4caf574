package mailgate.core.service.oauth;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import mailgate.core.config.OAuthConfig;
import mailgate.core.model.oauth.AuthorizationServerMetadata;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.OAuthRoute;

/**
 * Route table of the authorization server and the metadata document advertising it.
 */
@ApplicationScoped
public class OAuthRoutes {

    public static final String METADATA_PATH = "/.well-known/oauth-authorization-server";
    public static final String AUTHORIZE_PATH = "/authorize";
    public static final String TOKEN_PATH = "/token";
    public static final String REGISTER_PATH = "/register";
    public static final String REVOKE_PATH = "/revoke";
    public static final String CONSENT_PATH = "/oauth/consent";
    public static final String WHOAMI_PATH = "/oauth/whoami";

    private final OAuthConfig config;

    public OAuthRoutes(OAuthConfig config) {
        this.config = config;
    }

    /**
     * Routes exposed with the current configuration. Registration and
     * revocation are left out when disabled.
     */
    public List<OAuthRoute> routes() {
        final var routes = new ArrayList<OAuthRoute>();
        routes.add(new OAuthRoute(METADATA_PATH, Set.of("GET"), "metadata"));
        routes.add(new OAuthRoute(AUTHORIZE_PATH, Set.of("GET", "POST"), "authorize"));
        routes.add(new OAuthRoute(TOKEN_PATH, Set.of("POST"), "token"));
        if (config.registration().enabled()) {
            routes.add(new OAuthRoute(REGISTER_PATH, Set.of("POST"), "register"));
        }
        if (config.revocation().enabled()) {
            routes.add(new OAuthRoute(REVOKE_PATH, Set.of("POST"), "revoke"));
        }
        routes.add(new OAuthRoute(CONSENT_PATH, Set.of("GET", "POST"), "consent"));
        return List.copyOf(routes);
    }

    /**
     * Whether a named route is currently exposed.
     */
    public boolean isExposed(String name) {
        return routes().stream().anyMatch(route -> route.name().equals(name));
    }

    /**
     * Base URL without a trailing slash.
     */
    public String baseUrl() {
        return stripTrailingSlash(config.baseUrl());
    }

    /**
     * Issuer identifier, the base URL unless configured separately.
     */
    public String issuer() {
        return config.issuerUrl().map(OAuthRoutes::stripTrailingSlash).orElseGet(this::baseUrl);
    }

    /**
     * Absolute URL of the consent page.
     */
    public String consentUrl() {
        return baseUrl() + CONSENT_PATH;
    }

    public AuthorizationServerMetadata metadata() {
        final var issuer = issuer();
        final var authMethods = List.of(OAuthClient.AUTH_METHOD_CLIENT_SECRET_POST);
        final var validScopes = config.registration().validScopes().orElse(null);
        return new AuthorizationServerMetadata(
                issuer,
                issuer + AUTHORIZE_PATH,
                issuer + TOKEN_PATH,
                config.registration().enabled() ? issuer + REGISTER_PATH : null,
                config.revocation().enabled() ? issuer + REVOKE_PATH : null,
                validScopes,
                List.of(OAuthClient.RESPONSE_TYPE_CODE),
                List.of(OAuthClient.GRANT_AUTHORIZATION_CODE, OAuthClient.GRANT_REFRESH_TOKEN),
                authMethods,
                config.revocation().enabled() ? authMethods : null,
                List.of(PkceVerifier.S256_METHOD),
                config.serviceDocumentationUrl().orElse(null));
    }

    static String stripTrailingSlash(String url) {
        var result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
