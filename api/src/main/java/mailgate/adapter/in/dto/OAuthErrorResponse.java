package mailgate.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth error response body (RFC 6749 section 5.2, RFC 7591 section 3.2.2).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(
        @JsonProperty("error") String error, @JsonProperty("error_description") String errorDescription) {}
