package gridauth.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.SigningKeyRecord;

/**
 * SPI for signing key storage and retrieval.
 *
 * <p>Installations can back this with a KMS, Vault or database. The built-in
 * implementation keeps keys in memory and can load a bootstrap key from configuration.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Private keys MUST be stored securely (encrypted at rest)</li>
 *   <li>Status transitions MUST be atomic</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 *
 * <h2>Registration</h2>
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class VaultSigningKeyRepository implements SigningKeyRepository {
 * }
 * }</pre>
 *
 * @see gridauth.adapter.out.auth.ConfigSigningKeyRepository
 */
public interface SigningKeyRepository {

    /**
     * Store a signing key with its current status.
     */
    Uni<Void> store(SigningKeyRecord key);

    Uni<Optional<SigningKeyRecord>> findById(String keyId);

    /**
     * Get the current active signing key, the most recently activated if several exist.
     */
    Uni<Optional<SigningKeyRecord>> findActive();

    /**
     * Get all keys valid for verification (ACTIVE and RETIRING).
     */
    Uni<List<SigningKeyRecord>> findAllForVerification();

    Uni<List<SigningKeyRecord>> findByStatus(KeyStatus status);

    /**
     * Update a key's status following ACTIVE → RETIRING → REVOKED.
     *
     * @throws IllegalArgumentException (as a failed Uni) if the key does not exist
     */
    Uni<Void> updateStatus(String keyId, KeyStatus newStatus, Instant transitionTime);

    /**
     * Delete a key. Only REVOKED keys past the retention period should be deleted.
     */
    Uni<Void> delete(String keyId);

    Uni<List<SigningKeyRecord>> findAll();
}
