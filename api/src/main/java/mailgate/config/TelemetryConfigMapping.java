package mailgate.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code mailgate.telemetry}
 */
@ConfigMapping(prefix = "mailgate.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration options.
     */
    interface MetricsConfig {

        /**
         * Enable authorization server metrics.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
