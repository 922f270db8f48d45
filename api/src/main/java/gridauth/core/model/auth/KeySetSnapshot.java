package gridauth.core.model.auth;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable view of the signing keys at one point in time.
 *
 * <p>Readers hold on to a single snapshot for the whole of a signing or
 * verification operation, so they never observe a half-rotated key set.
 *
 * @param version          monotonically increasing snapshot number
 * @param activeKey        the key used for new signatures, if any
 * @param verificationKeys keys accepted for verification, by key id (no private material)
 * @param loadedAt         when the snapshot was built
 */
public record KeySetSnapshot(
        long version, SigningKeyRecord activeKey, Map<String, SigningKeyRecord> verificationKeys, Instant loadedAt) {

    public KeySetSnapshot {
        verificationKeys = verificationKeys != null ? Map.copyOf(verificationKeys) : Map.of();
    }

    public static KeySetSnapshot empty() {
        return new KeySetSnapshot(0, null, Map.of(), Instant.EPOCH);
    }

    /**
     * Build the next snapshot from the repository state.
     */
    public static KeySetSnapshot of(
            long version, SigningKeyRecord activeKey, List<SigningKeyRecord> verificationKeys, Instant loadedAt) {
        final var byId = verificationKeys.stream()
                .filter(SigningKeyRecord::canVerify)
                .map(SigningKeyRecord::withoutPrivateKey)
                .collect(Collectors.toMap(SigningKeyRecord::keyId, Function.identity(), (a, b) -> a));
        return new KeySetSnapshot(version, activeKey, byId, loadedAt);
    }

    public Optional<SigningKeyRecord> signingKey() {
        return Optional.ofNullable(activeKey).filter(SigningKeyRecord::canSign);
    }

    public Optional<SigningKeyRecord> verificationKey(String keyId) {
        return Optional.ofNullable(verificationKeys.get(keyId));
    }

    public List<SigningKeyRecord> publicKeys() {
        return List.copyOf(verificationKeys.values());
    }
}
