package mailgate.core.service.oauth;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import mailgate.core.config.OAuthConfig;
import mailgate.core.config.OAuthLifetimes;
import mailgate.core.model.oauth.AuthorizationCode;
import mailgate.core.model.oauth.ConsentAction;
import mailgate.core.model.oauth.ConsentResult;
import mailgate.core.model.oauth.PendingAuthorization;
import mailgate.core.port.in.ConsentManagement;
import mailgate.core.port.out.AuthorizationCodeRepository;
import mailgate.core.port.out.OAuthMetrics;
import mailgate.core.port.out.PendingAuthorizationRepository;
import mailgate.core.util.RedirectUris;
import mailgate.core.util.SecureHash;

/**
 * Operator consent step of the authorization code flow.
 *
 * <p>A pending transaction moves to exactly one terminal state: approved
 * (a code is minted), denied (the client gets {@code access_denied}) or
 * expired. A wrong password or an unsupported action re-renders the page and
 * leaves the transaction usable until it expires.
 */
@ApplicationScoped
public class ConsentService implements ConsentManagement {

    private static final Logger LOG = Logger.getLogger(ConsentService.class);

    static final String MISSING_TRANSACTION = "Missing transaction id";
    static final String EXPIRED_TRANSACTION = "Authorization request has expired. Restart the OAuth flow.";
    static final String INCORRECT_PASSWORD = "Incorrect authorization password.";
    static final String UNSUPPORTED_ACTION = "Unsupported action.";
    static final String ACCESS_DENIED = "access_denied";
    static final String ACCESS_DENIED_DESCRIPTION = "The resource owner denied the request.";

    private final PendingAuthorizationRepository pendingRepository;
    private final AuthorizationCodeRepository codeRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final ConsentPageRenderer renderer;
    private final OAuthMetrics metrics;
    private final Clock clock;
    private final OAuthLifetimes lifetimes;
    private final String consentPassword;

    public ConsentService(
            PendingAuthorizationRepository pendingRepository,
            AuthorizationCodeRepository codeRepository,
            SecureTokenGenerator tokenGenerator,
            ConsentPageRenderer renderer,
            OAuthConfig config,
            OAuthMetrics metrics,
            Clock clock) {
        this.consentPassword = config.consentPassword()
                .filter(password -> !password.isBlank())
                .orElseThrow(() -> new IllegalStateException(
                        "mailgate.oauth.consent-password must be set to a non-empty value"));
        this.pendingRepository = pendingRepository;
        this.codeRepository = codeRepository;
        this.tokenGenerator = tokenGenerator;
        this.renderer = renderer;
        this.metrics = metrics;
        this.clock = clock;
        this.lifetimes = OAuthLifetimes.from(config);
    }

    @Override
    public Uni<ConsentResult> showConsent(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            return Uni.createFrom().item(new ConsentResult.Rejected(MISSING_TRANSACTION));
        }
        return pendingRepository
                .findActive(transactionId, clock.instant(), lifetimes.pendingTtl())
                .map(found -> found.<ConsentResult>map(
                                pending -> new ConsentResult.Page(renderer.render(transactionId, pending, null)))
                        .orElseGet(() -> expired(transactionId)));
    }

    @Override
    public Uni<ConsentResult> submitConsent(String transactionId, String password, String action) {
        if (transactionId == null || transactionId.isBlank()) {
            return Uni.createFrom().item(new ConsentResult.Rejected(MISSING_TRANSACTION));
        }
        return pendingRepository
                .findActive(transactionId, clock.instant(), lifetimes.pendingTtl())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        metrics.recordConsentDecision("expired");
                        return Uni.createFrom().item(expired(transactionId));
                    }
                    final var pending = found.get();

                    if (!SecureHash.constantTimeEquals(consentPassword, password)) {
                        metrics.recordConsentDecision("bad_password");
                        LOG.infof("Rejected consent for transaction %s: incorrect password", transactionId);
                        return Uni.createFrom()
                                .<ConsentResult>item(new ConsentResult.Page(
                                        renderer.render(transactionId, pending, INCORRECT_PASSWORD)));
                    }

                    final var decision = ConsentAction.fromValue(action);
                    if (decision.isEmpty()) {
                        metrics.recordConsentDecision("unsupported_action");
                        return Uni.createFrom()
                                .<ConsentResult>item(new ConsentResult.Page(
                                        renderer.render(transactionId, pending, UNSUPPORTED_ACTION)));
                    }

                    return decision.get() == ConsentAction.DENY ? deny(transactionId) : approve(transactionId);
                });
    }

    private Uni<ConsentResult> deny(String transactionId) {
        return pendingRepository.remove(transactionId).<ConsentResult>map(removed -> {
            if (removed.isEmpty()) {
                return expired(transactionId);
            }
            final var pending = removed.get();
            metrics.recordConsentDecision("denied");
            LOG.infof("Consent denied for client %s", pending.client().clientId());

            final var params = new LinkedHashMap<String, String>();
            params.put("error", ACCESS_DENIED);
            params.put("error_description", ACCESS_DENIED_DESCRIPTION);
            params.put("state", pending.params().state());
            return new ConsentResult.Redirect(
                    RedirectUris.withParameters(pending.params().redirectUri(), params));
        });
    }

    private Uni<ConsentResult> approve(String transactionId) {
        return pendingRepository.remove(transactionId).flatMap(removed -> {
            if (removed.isEmpty()) {
                return Uni.createFrom().item(expired(transactionId));
            }
            final var pending = removed.get();
            final var code = mintCode(pending);
            return codeRepository.save(code).<ConsentResult>map(v -> {
                metrics.recordConsentDecision("approved");
                LOG.infof(
                        "Consent approved for client %s, issued authorization code %s",
                        pending.client().clientId(),
                        SecureHash.fingerprint(code.code()));

                final Map<String, String> params = new LinkedHashMap<>();
                params.put("code", code.code());
                params.put("state", pending.params().state());
                return new ConsentResult.Redirect(
                        RedirectUris.withParameters(pending.params().redirectUri(), params));
            });
        });
    }

    private AuthorizationCode mintCode(PendingAuthorization pending) {
        final var params = pending.params();
        return new AuthorizationCode(
                tokenGenerator.authorizationCode(),
                pending.client().clientId(),
                pending.scopes(),
                clock.instant().plus(lifetimes.authCodeTtl()),
                params.codeChallenge(),
                params.redirectUri(),
                params.redirectUriProvidedExplicitly(),
                params.resource());
    }

    private ConsentResult expired(String transactionId) {
        LOG.debugf("Consent transaction %s is unknown or expired", transactionId);
        return new ConsentResult.Rejected(EXPIRED_TRANSACTION);
    }
}
