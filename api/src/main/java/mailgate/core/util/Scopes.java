package mailgate.core.util;

import java.util.Collection;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * Conversions between OAuth scope strings and scope lists.
 *
 * <p>A scope string is a whitespace separated list of scope tokens (RFC 6749 section 3.3).
 */
public final class Scopes {

    private static final Splitter SPLITTER =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();
    private static final Joiner JOINER = Joiner.on(' ');

    private Scopes() {}

    /**
     * Split a scope string into its tokens.
     *
     * @param scope the scope string, may be null
     * @return scope tokens in order, empty for a null or blank string
     */
    public static List<String> parse(String scope) {
        if (scope == null) {
            return List.of();
        }
        return List.copyOf(SPLITTER.splitToList(scope));
    }

    /**
     * Join scope tokens with single spaces.
     */
    public static String join(Collection<String> scopes) {
        return scopes == null ? "" : JOINER.join(scopes);
    }
}
