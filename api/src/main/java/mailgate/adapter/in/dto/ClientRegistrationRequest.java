package mailgate.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import mailgate.core.model.oauth.ClientMetadata;

/**
 * Request body for dynamic client registration (RFC 7591 section 2).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRegistrationRequest(
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
        @JsonProperty("grant_types") List<String> grantTypes,
        @JsonProperty("response_types") List<String> responseTypes,
        @JsonProperty("scope") String scope,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("client_uri") String clientUri,
        @JsonProperty("logo_uri") String logoUri,
        @JsonProperty("contacts") List<String> contacts,
        @JsonProperty("software_id") String softwareId,
        @JsonProperty("software_version") String softwareVersion) {

    public ClientMetadata toModel() {
        return new ClientMetadata(
                redirectUris,
                tokenEndpointAuthMethod,
                grantTypes,
                responseTypes,
                scope,
                clientName,
                clientUri,
                logoUri,
                contacts,
                softwareId,
                softwareVersion);
    }
}
