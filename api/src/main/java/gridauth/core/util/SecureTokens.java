package gridauth.core.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random codes, secrets and verifiers.
 */
public final class SecureTokens {

    /** Consonants only, so user codes never spell words and are easy to type. */
    public static final String USER_CODE_ALPHABET = "BCDFGHJKLMNPQRSTVWXZ";

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureTokens() {}

    /**
     * URL-safe base64 (no padding) of {@code bytes} random bytes.
     */
    public static String urlSafe(int bytes) {
        final var buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    /**
     * Hex string of {@code bytes} random bytes.
     */
    public static String hex(int bytes) {
        final var buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    /**
     * Random user code drawn from {@link #USER_CODE_ALPHABET}.
     */
    public static String userCode(int length) {
        final var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(USER_CODE_ALPHABET.charAt(RANDOM.nextInt(USER_CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    public static byte[] randomBytes(int bytes) {
        final var buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return buffer;
    }
}
