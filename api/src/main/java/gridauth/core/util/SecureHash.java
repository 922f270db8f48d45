package gridauth.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for values that are stored or logged but must not be exposed.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Full SHA-256 hex digest of a string.
     */
    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Full SHA-256 hex digest of raw bytes.
     */
    public static String sha256Hex(byte[] input) {
        return HexFormat.of().formatHex(digest(input));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string, for log lines.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1 to 64)
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Compare two hex digests in constant time.
     */
    public static boolean digestsEqual(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }

    static byte[] digest(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }
}
