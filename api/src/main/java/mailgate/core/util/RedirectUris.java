package mailgate.core.util;

import java.net.URI;
import java.util.Map;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

/**
 * Builds redirect URIs carrying OAuth response parameters.
 */
public final class RedirectUris {

    private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

    private RedirectUris() {}

    /**
     * Append query parameters to a redirect URI.
     *
     * <p>Any query already present on the registered URI is kept. Parameters
     * with a null value are omitted. Iteration order of {@code params} is kept.
     *
     * @param redirectUri the client's redirect URI
     * @param params      parameters to append
     * @return the redirect target
     */
    public static URI withParameters(String redirectUri, Map<String, String> params) {
        final var base = URI.create(redirectUri);
        if (base.isOpaque()) {
            return opaqueWithParameters(base, params);
        }
        final var query = new StringBuilder();
        if (base.getRawQuery() != null && !base.getRawQuery().isEmpty()) {
            query.append(base.getRawQuery());
        }
        appendParameters(query, params);

        final var target = new StringBuilder();
        target.append(base.getScheme()).append(':');
        if (base.getRawAuthority() != null) {
            target.append("//").append(base.getRawAuthority());
        }
        if (base.getRawPath() != null) {
            target.append(base.getRawPath());
        }
        if (query.length() > 0) {
            target.append('?').append(query);
        }
        if (base.getRawFragment() != null) {
            target.append('#').append(base.getRawFragment());
        }
        return URI.create(target.toString());
    }

    /**
     * Opaque URIs such as {@code myapp:callback} have no path; parameters follow the scheme-specific part.
     */
    private static URI opaqueWithParameters(URI base, Map<String, String> params) {
        final var ssp = new StringBuilder(base.getRawSchemeSpecificPart());
        final var query = new StringBuilder();
        appendParameters(query, params);
        if (query.length() > 0) {
            ssp.append(ssp.indexOf("?") >= 0 ? '&' : '?').append(query);
        }
        final var target = new StringBuilder(base.getScheme()).append(':').append(ssp);
        if (base.getRawFragment() != null) {
            target.append('#').append(base.getRawFragment());
        }
        return URI.create(target.toString());
    }

    private static void appendParameters(StringBuilder query, Map<String, String> params) {
        params.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(ESCAPER.escape(name)).append('=').append(ESCAPER.escape(value));
        });
    }
}
