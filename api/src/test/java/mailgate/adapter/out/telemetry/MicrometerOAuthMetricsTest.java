package mailgate.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import mailgate.config.TelemetryConfigMapping;

@DisplayName("MicrometerOAuthMetrics")
class MicrometerOAuthMetricsTest {

    private SimpleMeterRegistry registry;
    private TelemetryConfigMapping config;
    private TelemetryConfigMapping.MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        config = mock(TelemetryConfigMapping.class);
        metricsConfig = mock(TelemetryConfigMapping.MetricsConfig.class);
        when(config.metrics()).thenReturn(metricsConfig);
    }

    private MicrometerOAuthMetrics metrics(boolean enabled) {
        when(metricsConfig.enabled()).thenReturn(enabled);
        return new MicrometerOAuthMetrics(registry, config);
    }

    @Nested
    @DisplayName("when enabled")
    class WhenEnabled {

        @Test
        @DisplayName("should count registrations")
        void shouldCountRegistrations() {
            var metrics = metrics(true);

            metrics.recordClientRegistered();
            metrics.recordClientRegistered();

            assertTrue(metrics.isEnabled());
            assertEquals(2.0, registry.get("mailgate.oauth.clients.registered").counter().count());
        }

        @Test
        @DisplayName("should tag consent decisions by outcome")
        void shouldTagConsentDecisions() {
            var metrics = metrics(true);

            metrics.recordConsentDecision("approved");
            metrics.recordConsentDecision("bad_password");
            metrics.recordConsentDecision("approved");

            assertEquals(
                    2.0,
                    registry.get("mailgate.oauth.consent.decisions")
                            .tag("outcome", "approved")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("mailgate.oauth.consent.decisions")
                            .tag("outcome", "bad_password")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should tag issued tokens and failures")
        void shouldTagTokens() {
            var metrics = metrics(true);

            metrics.recordTokensIssued("refresh_token");
            metrics.recordGrantFailure("invalid_grant");
            metrics.recordGrantFailure(null);
            metrics.recordRevocation();

            assertEquals(
                    1.0,
                    registry.get("mailgate.oauth.tokens.issued")
                            .tag("grant_type", "refresh_token")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("mailgate.oauth.grant.failures")
                            .tag("error", "unknown")
                            .counter()
                            .count());
            assertEquals(1.0, registry.get("mailgate.oauth.tokens.revoked").counter().count());
        }
    }

    @Nested
    @DisplayName("when disabled")
    class WhenDisabled {

        @Test
        @DisplayName("should record nothing")
        void shouldRecordNothing() {
            var metrics = metrics(false);

            metrics.recordClientRegistered();
            metrics.recordConsentDecision("approved");
            metrics.recordTokensIssued("authorization_code");
            metrics.recordGrantFailure("invalid_grant");
            metrics.recordRevocation();

            assertFalse(metrics.isEnabled());
            assertTrue(registry.getMeters().isEmpty());
            assertNull(registry.find("mailgate.oauth.clients.registered").counter());
        }
    }
}
