package mailgate.core.port.in;

import io.smallrye.mutiny.Uni;

import mailgate.core.model.oauth.ConsentResult;

/**
 * Use case for the operator consent step of the authorization code flow.
 */
public interface ConsentManagement {

    /**
     * Render the consent page for a pending transaction.
     *
     * @param transactionId the {@code tx} parameter, may be null
     * @return Uni with a {@link ConsentResult.Page} or {@link ConsentResult.Rejected}
     */
    Uni<ConsentResult> showConsent(String transactionId);

    /**
     * Process a consent form submission.
     *
     * @param transactionId the {@code tx} parameter, may be null
     * @param password      the submitted consent password
     * @param action        the submitted action, null meaning approve
     * @return Uni with the consent outcome
     */
    Uni<ConsentResult> submitConsent(String transactionId, String password, String action);
}
