package gridauth.core.service.flow;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jboss.logging.Logger;

import gridauth.core.config.FlowConfig;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.ServerFaultException;
import gridauth.core.model.flow.FlowState;
import gridauth.core.model.flow.GrantType;
import gridauth.core.util.SecureTokens;

/**
 * Encrypts the state carried through the IdP redirect.
 *
 * <p>Uses AES-256-GCM with a unique IV per operation, so the ciphertext is both
 * confidential and tamper-evident. Only state produced by this installation decrypts.
 *
 * <h2>Configuration</h2>
 * <pre>
 * gridauth.auth.flows.state-key=${FLOW_STATE_KEY}  # Base64-encoded 256-bit key
 * </pre>
 */
@ApplicationScoped
public class FlowStateCipher {

    private static final Logger LOG = Logger.getLogger(FlowStateCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public FlowStateCipher(FlowConfig config) {
        this(config.stateKey().filter(k -> !k.isBlank()).map(Base64.getDecoder()::decode).orElseGet(() -> {
            LOG.warn("gridauth.auth.flows.state-key is not set, using a random key. "
                    + "In-progress flows will not survive a restart or span instances.");
            return SecureTokens.randomBytes(KEY_LENGTH);
        }));
    }

    FlowStateCipher(byte[] keyBytes) {
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "State key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Encrypt a state blob.
     *
     * @return base64url ciphertext, safe to put in a query string
     */
    public String encrypt(FlowState state) {
        try {
            final var plaintext = MAPPER.writeValueAsBytes(StatePayload.from(state));

            final var iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final var ciphertext = cipher.doFinal(plaintext);

            final var buffer = ByteBuffer.allocate(IV_LENGTH + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new ServerFaultException("Failed to encrypt flow state", e);
        }
    }

    /**
     * Decrypt a state blob and check its age.
     *
     * @throws InvalidRequestException if the blob was not produced by this installation,
     *                                 is malformed or is older than {@code maxAge}
     */
    public FlowState decrypt(String encoded, Duration maxAge) {
        if (encoded == null || encoded.isBlank()) {
            throw new InvalidRequestException("Missing state");
        }
        final FlowState state;
        try {
            final var data = Base64.getUrlDecoder().decode(encoded);
            if (data.length <= IV_LENGTH) {
                throw new InvalidRequestException("Invalid state");
            }
            final var buffer = ByteBuffer.wrap(data);
            final var iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final var ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            state = MAPPER.readValue(cipher.doFinal(ciphertext), StatePayload.class).toState();
        } catch (IllegalArgumentException | NullPointerException | GeneralSecurityException | IOException e) {
            LOG.debugv("Rejected flow state: {0}", e.getMessage());
            throw new InvalidRequestException("Invalid state", e);
        }

        final var issuedAt = Instant.ofEpochSecond(state.issuedAt());
        if (Instant.now().isAfter(issuedAt.plus(maxAge))) {
            throw new InvalidRequestException("State has expired");
        }
        return state;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StatePayload(
            @JsonProperty("grant_type") String grantType,
            @JsonProperty("flow_id") String flowId,
            @JsonProperty("user_code") String userCode,
            @JsonProperty("vo") String vo,
            @JsonProperty("idp_code_verifier") String idpCodeVerifier,
            @JsonProperty("issued_at") long issuedAt) {

        static StatePayload from(FlowState state) {
            final var device = state.grantType() == GrantType.DEVICE_CODE;
            return new StatePayload(
                    state.grantType().value(),
                    device ? null : state.flowRef(),
                    device ? state.flowRef() : null,
                    state.vo(),
                    state.idpCodeVerifier(),
                    state.issuedAt());
        }

        FlowState toState() {
            final var type = GrantType.fromValue(grantType)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown grant type in state"));
            final var ref = type == GrantType.DEVICE_CODE ? userCode : flowId;
            return new FlowState(type, ref, vo, idpCodeVerifier, issuedAt);
        }
    }
}
