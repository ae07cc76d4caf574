package mailgate.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, non-reversible fingerprints of secret values.
 *
 * <p>Codes and tokens are bearer credentials and never appear in logs. Log
 * lines carry a truncated SHA-256 fingerprint instead so that the issue and
 * redemption of the same credential can still be correlated.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final int FINGERPRINT_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return HexFormat.of().formatHex(sha256(input.getBytes(StandardCharsets.UTF_8))).substring(0, hexChars);
    }

    /**
     * Fingerprint of a credential for log output.
     */
    public static String fingerprint(String secret) {
        return secret == null ? "-" : truncatedSha256(secret, FINGERPRINT_HEX_CHARS);
    }

    /**
     * Compare two secrets without leaking the position of the first difference.
     *
     * @return true when both are non-null and equal
     */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
