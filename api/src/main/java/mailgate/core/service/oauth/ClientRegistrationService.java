package mailgate.core.service.oauth;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import mailgate.core.config.OAuthConfig;
import mailgate.core.model.oauth.ClientMetadata;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.model.oauth.RegistrationException;
import mailgate.core.port.in.OAuthAuthorizationProvider;
import mailgate.core.util.Scopes;

/**
 * Dynamic client registration (RFC 7591).
 */
@ApplicationScoped
public class ClientRegistrationService {

    private static final List<String> REQUIRED_GRANT_TYPES =
            List.of(OAuthClient.GRANT_AUTHORIZATION_CODE, OAuthClient.GRANT_REFRESH_TOKEN);

    private final OAuthAuthorizationProvider provider;
    private final SecureTokenGenerator tokenGenerator;
    private final OAuthConfig config;
    private final Clock clock;

    public ClientRegistrationService(
            OAuthAuthorizationProvider provider, SecureTokenGenerator tokenGenerator, OAuthConfig config, Clock clock) {
        this.provider = provider;
        this.tokenGenerator = tokenGenerator;
        this.config = config;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config.registration().enabled();
    }

    /**
     * Validate client metadata, assign credentials and persist the client.
     *
     * @param metadata submitted client metadata
     * @return Uni with the registered client including its issued credentials
     * @throws RegistrationException (as a failed Uni) when the metadata is invalid
     */
    public Uni<OAuthClient> register(ClientMetadata metadata) {
        final OAuthClient client;
        try {
            client = buildClient(metadata);
        } catch (RegistrationException e) {
            return Uni.createFrom().failure(e);
        }
        return provider.registerClient(client).replaceWith(client);
    }

    private OAuthClient buildClient(ClientMetadata metadata) {
        final var redirectUris = validateRedirectUris(metadata.redirectUris());
        final var scope = resolveScope(metadata.scope());

        final var grantTypes = metadata.grantTypes() == null ? REQUIRED_GRANT_TYPES : metadata.grantTypes();
        if (!new HashSet<>(grantTypes).containsAll(REQUIRED_GRANT_TYPES)) {
            throw new RegistrationException(
                    RegistrationException.INVALID_CLIENT_METADATA,
                    "grant_types must be authorization_code and refresh_token");
        }
        if (metadata.responseTypes() != null && !metadata.responseTypes().contains(OAuthClient.RESPONSE_TYPE_CODE)) {
            throw new RegistrationException(
                    RegistrationException.INVALID_CLIENT_METADATA, "response_types must include 'code'");
        }

        final var authMethod = metadata.tokenEndpointAuthMethod() == null
                ? OAuthClient.AUTH_METHOD_CLIENT_SECRET_POST
                : metadata.tokenEndpointAuthMethod();
        if (!OAuthClient.AUTH_METHOD_CLIENT_SECRET_POST.equals(authMethod)
                && !OAuthClient.AUTH_METHOD_NONE.equals(authMethod)) {
            throw new RegistrationException(
                    RegistrationException.INVALID_CLIENT_METADATA,
                    "token_endpoint_auth_method '%s' is not supported".formatted(authMethod));
        }

        final long issuedAt = clock.instant().getEpochSecond();
        String secret = null;
        Long secretExpiresAt = null;
        if (!OAuthClient.AUTH_METHOD_NONE.equals(authMethod)) {
            secret = tokenGenerator.clientSecret();
            secretExpiresAt = config.registration()
                    .clientSecretTtl()
                    .map(ttl -> issuedAt + ttl.toSeconds())
                    .orElse(0L);
        }

        return new OAuthClient(
                tokenGenerator.clientId(),
                secret,
                issuedAt,
                secretExpiresAt,
                metadata.clientName(),
                redirectUris,
                scope,
                grantTypes,
                metadata.responseTypes(),
                authMethod,
                metadata.clientUri(),
                metadata.logoUri(),
                metadata.contacts(),
                metadata.softwareId(),
                metadata.softwareVersion());
    }

    private static List<String> validateRedirectUris(List<String> redirectUris) {
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw new RegistrationException(
                    RegistrationException.INVALID_REDIRECT_URI, "redirect_uris must contain at least one URI");
        }
        final var validated = new ArrayList<String>(redirectUris.size());
        for (String redirectUri : redirectUris) {
            if (!isAbsoluteUri(redirectUri)) {
                throw new RegistrationException(
                        RegistrationException.INVALID_REDIRECT_URI,
                        "Redirect URI '%s' is not an absolute URI".formatted(redirectUri));
            }
            validated.add(redirectUri);
        }
        return validated;
    }

    private String resolveScope(String requested) {
        if (requested == null) {
            final var defaults = config.registration().defaultScopes().orElse(List.of());
            return defaults.isEmpty() ? null : Scopes.join(defaults);
        }
        final var validScopes = config.registration().validScopes().orElse(List.of());
        if (!validScopes.isEmpty()) {
            final var invalid = new ArrayList<>(Scopes.parse(requested));
            invalid.removeAll(validScopes);
            if (!invalid.isEmpty()) {
                throw new RegistrationException(
                        RegistrationException.INVALID_CLIENT_METADATA,
                        "Requested scopes are not valid: %s".formatted(Scopes.join(invalid)));
            }
        }
        return requested;
    }

    private static boolean isAbsoluteUri(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            return new URI(value).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
