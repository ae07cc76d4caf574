package mailgate.core.model.oauth;

import java.util.List;

/**
 * Client metadata submitted for dynamic registration (RFC 7591 section 2).
 *
 * <p>Unvalidated; list fields may be null when the client omitted them.
 */
public record ClientMetadata(
        List<String> redirectUris,
        String tokenEndpointAuthMethod,
        List<String> grantTypes,
        List<String> responseTypes,
        String scope,
        String clientName,
        String clientUri,
        String logoUri,
        List<String> contacts,
        String softwareId,
        String softwareVersion) {}
