package mailgate.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the local OAuth 2.1 authorization provider.
 *
 * <p>Configuration prefix: {@code mailgate.oauth}
 *
 * <p>Lifetimes below their floor are raised to the floor, see {@link OAuthLifetimes}.
 */
@ConfigMapping(prefix = "mailgate.oauth")
public interface OAuthConfig {

    /**
     * Public base URL of this server. Consent URLs are built from it.
     *
     * @return base URL (default: http://127.0.0.1:8000)
     */
    @WithDefault("http://127.0.0.1:8000")
    String baseUrl();

    /**
     * Issuer advertised in the authorization server metadata.
     *
     * @return issuer URL, defaults to the base URL when absent
     */
    Optional<String> issuerUrl();

    /**
     * Human readable documentation advertised in the metadata.
     */
    Optional<String> serviceDocumentationUrl();

    /**
     * Shared password the operator enters to approve or deny a request.
     *
     * <p>Required. Startup fails when missing or blank.
     */
    Optional<String> consentPassword();

    /**
     * JSON file holding registered clients.
     *
     * @return store path (default: data/oauth_clients.json)
     */
    @WithDefault("data/oauth_clients.json")
    String clientStorePath();

    /**
     * Scopes added to every authorization, even when not requested.
     */
    Optional<List<String>> requiredScopes();

    /**
     * How long a consent transaction stays usable.
     *
     * @return pending TTL (default: 10 minutes, floor 60 seconds)
     */
    @WithDefault("PT10M")
    Duration pendingTtl();

    /**
     * Authorization code lifetime.
     *
     * @return code TTL (default: 10 minutes, floor 60 seconds)
     */
    @WithDefault("PT10M")
    Duration authCodeTtl();

    /**
     * Access token lifetime.
     *
     * @return access token TTL (default: 1 hour, floor 5 minutes)
     */
    @WithDefault("PT1H")
    Duration accessTokenTtl();

    /**
     * Refresh token lifetime. Absent means refresh tokens never expire.
     */
    Optional<Duration> refreshTokenTtl();

    /**
     * Dynamic client registration options.
     */
    RegistrationConfig registration();

    /**
     * Token revocation options.
     */
    RevocationConfig revocation();

    /**
     * Dynamic client registration options.
     */
    interface RegistrationConfig {

        /**
         * Expose the registration endpoint.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Scopes clients may register and request. Absent means unrestricted.
         */
        Optional<List<String>> validScopes();

        /**
         * Scopes assigned to clients that register without a scope.
         */
        Optional<List<String>> defaultScopes();

        /**
         * Lifetime of issued client secrets. Absent means secrets never expire.
         */
        Optional<Duration> clientSecretTtl();
    }

    /**
     * Token revocation options.
     */
    interface RevocationConfig {

        /**
         * Expose the revocation endpoint.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
