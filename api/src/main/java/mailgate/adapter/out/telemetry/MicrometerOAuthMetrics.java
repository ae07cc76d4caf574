package mailgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import mailgate.config.TelemetryConfigMapping;
import mailgate.core.port.out.OAuthMetrics;

/**
 * Records authorization server metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code mailgate.oauth.clients.registered} - Client registrations</li>
 *   <li>{@code mailgate.oauth.consent.decisions} - Consent submissions by outcome</li>
 *   <li>{@code mailgate.oauth.tokens.issued} - Token pairs issued by grant type</li>
 *   <li>{@code mailgate.oauth.grant.failures} - Failed token requests by OAuth error</li>
 *   <li>{@code mailgate.oauth.tokens.revoked} - Revoked tokens</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerOAuthMetrics implements OAuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerOAuthMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordClientRegistered() {
        if (!enabled) {
            return;
        }

        Counter.builder("mailgate.oauth.clients.registered")
                .description("Number of dynamically registered clients")
                .register(registry)
                .increment();
    }

    @Override
    public void recordConsentDecision(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("mailgate.oauth.consent.decisions")
                .description("Consent form submissions by outcome")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokensIssued(String grantType) {
        if (!enabled) {
            return;
        }

        Counter.builder("mailgate.oauth.tokens.issued")
                .description("Access and refresh token pairs issued")
                .tag("grant_type", nullSafe(grantType))
                .register(registry)
                .increment();
    }

    @Override
    public void recordGrantFailure(String error) {
        if (!enabled) {
            return;
        }

        Counter.builder("mailgate.oauth.grant.failures")
                .description("Failed token requests by OAuth error code")
                .tag("error", nullSafe(error))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRevocation() {
        if (!enabled) {
            return;
        }

        Counter.builder("mailgate.oauth.tokens.revoked")
                .description("Access and refresh tokens revoked")
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
