package mailgate.adapter.in.auth;

import java.net.URI;
import java.net.URISyntaxException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import mailgate.core.config.OAuthConfig;

/**
 * Startup guard for the authorization server configuration.
 *
 * <p>Observes the application startup event and fails fast when the consent
 * password is missing or the base URL cannot be used to build consent links.
 */
@ApplicationScoped
public class ConsentPasswordGuard {

    private static final Logger LOG = Logger.getLogger(ConsentPasswordGuard.class);

    private final OAuthConfig config;

    public ConsentPasswordGuard(OAuthConfig config) {
        this.config = config;
    }

    /**
     * @throws IllegalStateException if the configuration is unusable
     */
    void onStart(@Observes StartupEvent event) {
        validate();
    }

    void validate() {
        if (config.consentPassword().map(String::isBlank).orElse(true)) {
            LOG.error("mailgate.oauth.consent-password is not set");
            throw new IllegalStateException("mailgate.oauth.consent-password must be set to a non-empty value. "
                    + "It protects the consent page that approves OAuth clients.");
        }
        if (!isAbsolute(config.baseUrl())) {
            LOG.errorf("mailgate.oauth.base-url is not an absolute URL: %s", config.baseUrl());
            throw new IllegalStateException("mailgate.oauth.base-url must be an absolute URL: " + config.baseUrl());
        }
        LOG.infof("Local OAuth authorization server enabled at %s", config.baseUrl());
    }

    private static boolean isAbsolute(String url) {
        try {
            return new URI(url).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
