package gridauth.adapter.in.http;

import java.math.BigInteger;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import gridauth.core.model.auth.SigningKeyRecord;

/**
 * Renders verification keys as an RFC 7517 JSON Web Key Set.
 */
final class JwkSetFactory {

    private JwkSetFactory() {}

    static Map<String, Object> jwks(List<SigningKeyRecord> keys) {
        return Map.of("keys", keys.stream().map(JwkSetFactory::toJwk).toList());
    }

    private static Map<String, Object> toJwk(SigningKeyRecord keyRecord) {
        final var publicKey = keyRecord.publicKey();
        return Map.of(
                "kty", "RSA",
                "kid", keyRecord.keyId(),
                "use", "sig",
                "alg", keyRecord.algorithm(),
                "n", base64UrlEncode(publicKey.getModulus()),
                "e", base64UrlEncode(publicKey.getPublicExponent()));
    }

    /**
     * Unsigned big-endian bytes without leading zeros, base64url encoded (RFC 7518 section 2).
     */
    private static String base64UrlEncode(BigInteger value) {
        var bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            final var trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            bytes = trimmed;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
