package gridauth.core.port.in;

import java.security.interfaces.RSAPrivateKey;
import java.util.List;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.SigningKeyRecord;

/**
 * Port for administering the signing keys.
 *
 * <p>Returned records never carry private key material.
 */
public interface KeyManagement {

    /**
     * Generate a key of the configured size, make it active and retire the previous one.
     *
     * @return Uni with the new active key
     */
    Uni<SigningKeyRecord> rotateKeys();

    /**
     * Make the supplied key active and retire the previous one.
     *
     * @param keyId      key id to publish in the {@code kid} header
     * @param privateKey RSA private key (CRT form, so the public key can be derived)
     * @return Uni with the new active key
     */
    Uni<SigningKeyRecord> rotateKeys(String keyId, RSAPrivateKey privateKey);

    /**
     * Revoke retiring keys whose retirement window elapsed and delete revoked keys past retention.
     */
    Uni<Void> processKeyLifecycle();

    Uni<List<SigningKeyRecord>> listKeys();

    Uni<SigningKeyRecord> getKey(String keyId);

    /**
     * Revoke a key immediately. Tokens it signed stop verifying.
     */
    Uni<Void> forceRevoke(String keyId);
}
