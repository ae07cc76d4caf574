package mailgate.core.port.out;

/**
 * Port for recording authorization server metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface OAuthMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a successful client registration.
     */
    void recordClientRegistered();

    /**
     * Record the outcome of a consent submission.
     *
     * @param outcome one of {@code approved}, {@code denied}, {@code bad_password},
     *                {@code unsupported_action}, {@code expired}
     */
    void recordConsentDecision(String outcome);

    /**
     * Record a token pair issued by a grant.
     *
     * @param grantType {@code authorization_code} or {@code refresh_token}
     */
    void recordTokensIssued(String grantType);

    /**
     * Record a failed token request.
     *
     * @param error the OAuth error code
     */
    void recordGrantFailure(String error);

    /**
     * Record a token revocation.
     */
    void recordRevocation();
}
