package mailgate.core.model.oauth;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import mailgate.core.util.Scopes;

/**
 * A dynamically registered OAuth client (RFC 7591 client information).
 *
 * <p>The same shape is returned from the registration endpoint and persisted
 * by the client store, so every field carries its RFC 7591 wire name.
 *
 * @param clientId                unique client identifier
 * @param clientSecret            shared secret for {@code client_secret_post}, null for public clients
 * @param clientIdIssuedAt        epoch seconds at which the id was issued
 * @param clientSecretExpiresAt   epoch seconds at which the secret expires, 0 or null for never
 * @param clientName              human readable name shown on the consent page
 * @param redirectUris            registered redirect URIs (at least one)
 * @param scope                   space separated scopes the client may request
 * @param grantTypes              grant types the client may use
 * @param responseTypes           response types the client may use
 * @param tokenEndpointAuthMethod {@code client_secret_post} or {@code none}
 * @param clientUri               optional home page of the client
 * @param logoUri                 optional logo location
 * @param contacts                optional contact addresses
 * @param softwareId              optional software identifier
 * @param softwareVersion         optional software version
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthClient(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("client_id_issued_at") Long clientIdIssuedAt,
        @JsonProperty("client_secret_expires_at") Long clientSecretExpiresAt,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("scope") String scope,
        @JsonProperty("grant_types") List<String> grantTypes,
        @JsonProperty("response_types") List<String> responseTypes,
        @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
        @JsonProperty("client_uri") String clientUri,
        @JsonProperty("logo_uri") String logoUri,
        @JsonProperty("contacts") List<String> contacts,
        @JsonProperty("software_id") String softwareId,
        @JsonProperty("software_version") String softwareVersion) {

    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";
    public static final String RESPONSE_TYPE_CODE = "code";
    public static final String AUTH_METHOD_CLIENT_SECRET_POST = "client_secret_post";
    public static final String AUTH_METHOD_NONE = "none";

    public OAuthClient {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("client_id cannot be null or blank");
        }
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw new IllegalArgumentException("redirect_uris must contain at least one URI");
        }
        for (String redirectUri : redirectUris) {
            if (redirectUri == null || !URI.create(redirectUri).isAbsolute()) {
                throw new IllegalArgumentException("redirect_uris must be absolute URIs: " + redirectUri);
            }
        }
        redirectUris = List.copyOf(redirectUris);
        grantTypes = grantTypes == null || grantTypes.isEmpty()
                ? List.of(GRANT_AUTHORIZATION_CODE, GRANT_REFRESH_TOKEN)
                : List.copyOf(grantTypes);
        responseTypes =
                responseTypes == null || responseTypes.isEmpty() ? List.of(RESPONSE_TYPE_CODE) : List.copyOf(responseTypes);
        if (tokenEndpointAuthMethod == null || tokenEndpointAuthMethod.isBlank()) {
            tokenEndpointAuthMethod = AUTH_METHOD_CLIENT_SECRET_POST;
        }
        contacts = contacts == null ? null : List.copyOf(contacts);
    }

    /**
     * Name to show to the operator, falling back to the client id.
     */
    @JsonIgnore
    public String displayName() {
        return clientName != null && !clientName.isBlank() ? clientName : clientId;
    }

    /**
     * Scopes from the registered scope string, empty when none were registered.
     */
    @JsonIgnore
    public List<String> registeredScopes() {
        return Scopes.parse(scope);
    }

    @JsonIgnore
    public boolean supportsGrantType(String grantType) {
        return grantTypes.contains(grantType);
    }

    @JsonIgnore
    public boolean isPublic() {
        return clientSecret == null;
    }

    /**
     * Resolve the redirect URI to use for an authorization request.
     *
     * <p>An explicit URI must be one of the registered ones. Without one, the
     * client must have registered exactly one redirect URI.
     *
     * @param requested the redirect_uri request parameter, may be null
     * @return the redirect URI, or empty when none can be used
     */
    public Optional<String> resolveRedirectUri(String requested) {
        if (requested != null) {
            return redirectUris.contains(requested) ? Optional.of(requested) : Optional.empty();
        }
        return redirectUris.size() == 1 ? Optional.of(redirectUris.get(0)) : Optional.empty();
    }

    /**
     * Creates a copy carrying the given secret and its expiry.
     */
    public OAuthClient withSecret(String secret, Long secretExpiresAt) {
        return new OAuthClient(
                clientId,
                secret,
                clientIdIssuedAt,
                secretExpiresAt,
                clientName,
                redirectUris,
                scope,
                grantTypes,
                responseTypes,
                tokenEndpointAuthMethod,
                clientUri,
                logoUri,
                contacts,
                softwareId,
                softwareVersion);
    }
}
