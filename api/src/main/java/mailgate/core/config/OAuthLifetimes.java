package mailgate.core.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Effective credential lifetimes after applying the configured floors.
 *
 * @param pendingTtl      consent transaction lifetime
 * @param authCodeTtl     authorization code lifetime
 * @param accessTokenTtl  access token lifetime
 * @param refreshTokenTtl refresh token lifetime, empty for non-expiring refresh tokens
 */
public record OAuthLifetimes(
        Duration pendingTtl, Duration authCodeTtl, Duration accessTokenTtl, Optional<Duration> refreshTokenTtl) {

    static final Duration MIN_PENDING_TTL = Duration.ofSeconds(60);
    static final Duration MIN_AUTH_CODE_TTL = Duration.ofSeconds(60);
    static final Duration MIN_ACCESS_TOKEN_TTL = Duration.ofSeconds(300);

    public OAuthLifetimes {
        pendingTtl = atLeast(pendingTtl, MIN_PENDING_TTL);
        authCodeTtl = atLeast(authCodeTtl, MIN_AUTH_CODE_TTL);
        accessTokenTtl = atLeast(accessTokenTtl, MIN_ACCESS_TOKEN_TTL);
        refreshTokenTtl = refreshTokenTtl == null ? Optional.empty() : refreshTokenTtl;
    }

    public static OAuthLifetimes from(OAuthConfig config) {
        return new OAuthLifetimes(
                config.pendingTtl(), config.authCodeTtl(), config.accessTokenTtl(), config.refreshTokenTtl());
    }

    private static Duration atLeast(Duration value, Duration floor) {
        if (value == null || value.compareTo(floor) < 0) {
            return floor;
        }
        return value;
    }
}
