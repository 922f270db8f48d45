package gridauth.adapter.in.rest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gridauth.adapter.in.problem.AuthProblem;
import gridauth.core.model.auth.KeyStatus;
import gridauth.core.model.auth.SigningKeyRecord;
import gridauth.core.port.in.KeyManagement;

/**
 * REST resource for signing key administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Listing all signing keys and their statuses</li>
 *   <li>Viewing details of a specific key</li>
 *   <li>Rotating to a generated or supplied key</li>
 *   <li>Running the key lifecycle on demand</li>
 *   <li>Revoking a key immediately</li>
 * </ul>
 */
@Path("/admin/keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(AdminRoles.SERVICE_ADMINISTRATOR)
public class SigningKeyResource {

    private final KeyManagement keyManagement;

    @Inject
    public SigningKeyResource(KeyManagement keyManagement) {
        this.keyManagement = keyManagement;
    }

    @GET
    public Uni<List<KeySummaryResponse>> listKeys() {
        return keyManagement.listKeys().map(keys -> keys.stream().map(KeySummaryResponse::from).toList());
    }

    /**
     * Get details of a specific key.
     *
     * @param keyId The key identifier
     * @param includePublicKey Whether to include public key parameters in the response
     * @return Key details (private key excluded)
     */
    @GET
    @Path("/{keyId}")
    public Uni<KeyDetailResponse> getKey(
            @PathParam("keyId") String keyId, @QueryParam("include_public_key") boolean includePublicKey) {
        return keyManagement.getKey(keyId).map(key -> KeyDetailResponse.from(key, includePublicKey));
    }

    /**
     * Make a new key active. The previous active key keeps verifying until its
     * retirement window elapses.
     *
     * @param request optional; when it carries a PEM private key, that key is installed
     *                instead of a generated one
     * @return 201 Created with the new active key
     */
    @POST
    @Path("/rotate")
    public Uni<Response> rotateKeys(RotateKeyRequest request) {
        final Uni<SigningKeyRecord> rotated;
        if (request != null && request.privateKey() != null && !request.privateKey().isBlank()) {
            if (request.keyId() == null || request.keyId().isBlank()) {
                throw AuthProblem.invalidRequest("key_id is required with private_key");
            }
            rotated = keyManagement.rotateKeys(request.keyId(), SigningKeyRecord.parsePrivateKey(request.privateKey()));
        } else {
            rotated = keyManagement.rotateKeys();
        }
        return rotated.map(key -> Response.status(Response.Status.CREATED)
                .entity(KeySummaryResponse.from(key))
                .build());
    }

    /**
     * Revoke retiring keys past their window and delete revoked keys past retention.
     */
    @POST
    @Path("/lifecycle")
    public Uni<Response> processLifecycle() {
        return keyManagement.processKeyLifecycle().map(v -> Response.noContent().build());
    }

    /**
     * Revoke a key immediately.
     *
     * <p><strong>Warning:</strong> every token signed with this key stops verifying.
     *
     * @param keyId The key identifier to revoke
     * @param force Must be true to confirm revocation
     * @return 204 No Content on success
     */
    @DELETE
    @Path("/{keyId}")
    public Uni<Response> revokeKey(@PathParam("keyId") String keyId, @QueryParam("force") boolean force) {
        if (!force) {
            throw AuthProblem.invalidRequest(
                    "Revoking a key invalidates all tokens signed with it. Add ?force=true to confirm.");
        }
        return keyManagement.forceRevoke(keyId).map(v -> Response.noContent().build());
    }

    // ========================================================================
    // Request/Response DTOs
    // ========================================================================

    public record RotateKeyRequest(String keyId, String privateKey) {}

    public record KeySummaryResponse(
            String keyId,
            KeyStatus status,
            Instant createdAt,
            Instant activatedAt,
            Instant retiringAt,
            Instant revokedAt) {
        public static KeySummaryResponse from(SigningKeyRecord key) {
            return new KeySummaryResponse(
                    key.keyId(), key.status(), key.createdAt(), key.activatedAt(), key.retiringAt(), key.revokedAt());
        }
    }

    public record KeyDetailResponse(
            String keyId,
            String algorithm,
            KeyStatus status,
            Instant createdAt,
            Instant activatedAt,
            Instant retiringAt,
            Instant revokedAt,
            boolean canSign,
            boolean canVerify,
            Map<String, Object> publicKey) {
        public static KeyDetailResponse from(SigningKeyRecord key, boolean includePublicKey) {
            Map<String, Object> publicKeyInfo = null;
            if (includePublicKey && key.publicKey() != null) {
                publicKeyInfo = Map.of(
                        "algorithm", key.publicKey().getAlgorithm(),
                        "format", key.publicKey().getFormat(),
                        "modulus_bits", key.publicKey().getModulus().bitLength());
            }

            return new KeyDetailResponse(
                    key.keyId(),
                    key.algorithm(),
                    key.status(),
                    key.createdAt(),
                    key.activatedAt(),
                    key.retiringAt(),
                    key.revokedAt(),
                    key.canSign(),
                    key.canVerify(),
                    publicKeyInfo);
        }
    }
}
