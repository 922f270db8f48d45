package gridauth.core.service.flow;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiPredicate;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.core.config.FlowConfig;
import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.ServerFaultException;
import gridauth.core.exception.UpstreamRejectedException;
import gridauth.core.model.auth.CredentialKind;
import gridauth.core.model.auth.Identity;
import gridauth.core.model.auth.IssuedTokens;
import gridauth.core.model.auth.LifetimeClass;
import gridauth.core.model.auth.TokenExtras;
import gridauth.core.model.flow.AuthorizationCodeGrant;
import gridauth.core.model.flow.AuthorizationFlowRecord;
import gridauth.core.model.flow.AuthorizationFlowStart;
import gridauth.core.model.flow.DeviceCodeGrant;
import gridauth.core.model.flow.DeviceFlowRecord;
import gridauth.core.model.flow.DeviceFlowStart;
import gridauth.core.model.flow.DevicePollResult;
import gridauth.core.model.flow.FlowCompletion;
import gridauth.core.model.flow.FlowState;
import gridauth.core.model.flow.FlowStatus;
import gridauth.core.model.flow.GrantType;
import gridauth.core.model.flow.IdpIdentity;
import gridauth.core.port.in.FlowUseCase;
import gridauth.core.port.out.AuthMetrics;
import gridauth.core.port.out.AuthorizationFlowRepository;
import gridauth.core.port.out.DeviceFlowRepository;
import gridauth.core.port.out.IdentityProviderClient;
import gridauth.core.service.auth.ScopeResolver;
import gridauth.core.service.auth.TokenIssuer;
import gridauth.core.util.SecureHash;
import gridauth.core.util.SecureTokens;

/**
 * Drives the authorization code and device flows.
 *
 * <h2>Authorization code flow</h2>
 * <ol>
 *   <li>{@link #startAuthorization} stores a PENDING flow and sends the browser to the IdP</li>
 *   <li>{@link #completeFlow} runs the inner code exchange with the IdP, moves the flow to
 *       AUTHORIZED and redirects back to the client with a fresh code</li>
 *   <li>{@link #exchange} trades that code plus the PKCE verifier for tokens, once</li>
 * </ol>
 *
 * <h2>Device flow</h2>
 * The device polls {@link #pollDevice} while the user opens the verification page
 * ({@link #beginDeviceVerification}) and logs in at the IdP.
 *
 * <p>Every status change is a compare-and-swap on the stored record, so a racing caller
 * loses with {@link ExpiredOrConsumedException} rather than succeeding twice. Only the
 * subject and username asserted by the IdP ID token are kept; IdP tokens are discarded.
 */
@ApplicationScoped
public class FlowOrchestrator implements FlowUseCase {

    private static final Logger LOG = Logger.getLogger(FlowOrchestrator.class);

    static final String AUTHORIZE_CALLBACK_PATH = "/api/auth/authorize/complete";
    static final String DEVICE_CALLBACK_PATH = "/api/auth/device/complete";
    static final String DEVICE_VERIFICATION_PATH = "/api/auth/device";

    private static final int CODE_BYTES = 32;
    private static final int MAX_USER_CODE_ATTEMPTS = 5;
    private static final String IDP_SCOPE = "openid profile";

    private final AuthorizationFlowRepository authorizationFlows;
    private final DeviceFlowRepository deviceFlows;
    private final IdentityProviderClient idpClient;
    private final ScopeResolver scopeResolver;
    private final TokenIssuer tokenIssuer;
    private final PkceVerifier pkce;
    private final FlowStateCipher stateCipher;
    private final AuthMetrics metrics;
    private final FlowConfig config;

    @Inject
    public FlowOrchestrator(
            AuthorizationFlowRepository authorizationFlows,
            DeviceFlowRepository deviceFlows,
            IdentityProviderClient idpClient,
            ScopeResolver scopeResolver,
            TokenIssuer tokenIssuer,
            PkceVerifier pkce,
            FlowStateCipher stateCipher,
            AuthMetrics metrics,
            FlowConfig config) {
        this.authorizationFlows = authorizationFlows;
        this.deviceFlows = deviceFlows;
        this.idpClient = idpClient;
        this.scopeResolver = scopeResolver;
        this.tokenIssuer = tokenIssuer;
        this.pkce = pkce;
        this.stateCipher = stateCipher;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<AuthorizationFlowStart> startAuthorization(
            String clientId,
            String scope,
            String redirectUri,
            String codeChallenge,
            String challengeMethod,
            String externalState) {
        return Uni.createFrom().deferred(() -> {
            requireClient(clientId);
            if (redirectUri == null || !config.allowedRedirects().contains(redirectUri)) {
                throw new InvalidRequestException("redirect_uri is not allowed: " + redirectUri);
            }
            pkce.validateChallenge(codeChallenge, challengeMethod);
            final var resolved = scopeResolver.resolve(scope);

            final var now = Instant.now();
            final var flow = AuthorizationFlowRecord.pending(
                    UUID.randomUUID().toString(),
                    clientId,
                    scope,
                    redirectUri,
                    codeChallenge,
                    externalState,
                    now,
                    now.plus(config.authorizationFlowLifetime()));

            return authorizationFlows.insert(flow).<AuthorizationFlowStart>flatMap(inserted -> {
                if (!inserted) {
                    return Uni.createFrom().failure(new ServerFaultException("Flow id collision: " + flow.id()));
                }
                LOG.debugv("Started authorization flow {0} for VO {1}", flow.id(), resolved.vo());
                return idpRedirect(GrantType.AUTHORIZATION_CODE, flow.id(), resolved.vo(), AUTHORIZE_CALLBACK_PATH)
                        .map(url -> new AuthorizationFlowStart(flow.id(), url));
            });
        });
    }

    @Override
    public Uni<DeviceFlowStart> startDevice(String clientId, String scope, String codeChallenge, String challengeMethod) {
        return Uni.createFrom().deferred(() -> {
            requireClient(clientId);
            pkce.validateChallenge(codeChallenge, challengeMethod);
            final var resolved = scopeResolver.resolve(scope);
            return insertDeviceFlow(clientId, scope, codeChallenge, 1).map(started -> {
                LOG.debugv("Started device flow for VO {0}", resolved.vo());
                return started;
            });
        });
    }

    private Uni<DeviceFlowStart> insertDeviceFlow(String clientId, String scope, String codeChallenge, int attempt) {
        final var deviceCode = SecureTokens.urlSafe(CODE_BYTES);
        final var userCode = SecureTokens.userCode(config.userCodeLength());
        final var now = Instant.now();
        final var flow = DeviceFlowRecord.pending(
                SecureHash.sha256Hex(deviceCode),
                userCode,
                clientId,
                scope,
                codeChallenge,
                config.pollInterval(),
                now,
                now.plus(config.deviceFlowLifetime()));

        return deviceFlows.insert(flow).<DeviceFlowStart>flatMap(inserted -> {
            if (inserted) {
                final var verificationUri = config.publicBaseUrl() + DEVICE_VERIFICATION_PATH;
                return Uni.createFrom()
                        .item(new DeviceFlowStart(
                                deviceCode,
                                userCode,
                                verificationUri,
                                verificationUri + "?user_code=" + userCode,
                                config.pollInterval(),
                                config.deviceFlowLifetime()));
            }
            if (attempt >= MAX_USER_CODE_ATTEMPTS) {
                return Uni.createFrom()
                        .failure(new ServerFaultException(
                                "Could not allocate a unique user code after " + attempt + " attempts"));
            }
            LOG.debugv("User code collision, retrying (attempt {0})", attempt);
            return insertDeviceFlow(clientId, scope, codeChallenge, attempt + 1);
        });
    }

    @Override
    public Uni<String> beginDeviceVerification(String userCode) {
        if (userCode == null || userCode.isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("Missing user_code"));
        }
        final var normalized = userCode.trim().replace("-", "").toUpperCase();
        return deviceFlows.findByUserCode(normalized).flatMap(found -> {
            final var flow = found.filter(f -> f.status() == FlowStatus.PENDING && !f.isExpired(Instant.now()))
                    .orElseThrow(() -> new ExpiredOrConsumedException("Invalid or expired user code"));
            final var vo = scopeResolver.resolve(flow.scope()).vo();
            return idpRedirect(GrantType.DEVICE_CODE, flow.userCode(), vo, DEVICE_CALLBACK_PATH);
        });
    }

    @Override
    public Uni<FlowCompletion> completeFlow(String idpCode, String idpError, String encryptedState) {
        return Uni.createFrom().deferred(() -> {
            final var state = stateCipher.decrypt(encryptedState, maxFlowLifetime());
            if (state.grantType() == GrantType.DEVICE_CODE) {
                return completeDevice(state, idpCode, idpError);
            }
            return completeAuthorization(state, idpCode, idpError);
        });
    }

    private Uni<FlowCompletion> completeAuthorization(FlowState state, String idpCode, String idpError) {
        return authorizationFlows.findById(state.flowRef()).<FlowCompletion>flatMap(found -> {
            final var flow = requirePending(found, AuthorizationFlowRecord::status, AuthorizationFlowRecord::isExpired);
            if (idpError != null) {
                return authorizationFlows
                        .replace(flow, flow.withStatus(FlowStatus.DENIED))
                        .<FlowCompletion>flatMap(ignored -> denied(GrantType.AUTHORIZATION_CODE, idpError));
            }
            return innerExchange(state, idpCode, AUTHORIZE_CALLBACK_PATH)
                    .onFailure(UpstreamRejectedException.class)
                    .call(() -> authorizationFlows.replace(flow, flow.withStatus(FlowStatus.DENIED)))
                    .flatMap(identity -> {
                        final var code = SecureTokens.urlSafe(CODE_BYTES);
                        final var authorized = flow.authorize(SecureHash.sha256Hex(code), identity);
                        return authorizationFlows.replace(flow, authorized).map(swapped -> {
                            if (!swapped) {
                                throw new ExpiredOrConsumedException("Flow was already completed");
                            }
                            LOG.debugv("Authorization flow {0} authorized", flow.id());
                            return (FlowCompletion) new FlowCompletion.ClientRedirect(clientRedirect(flow, code));
                        });
                    });
        });
    }

    private Uni<FlowCompletion> completeDevice(FlowState state, String idpCode, String idpError) {
        return deviceFlows.findByUserCode(state.flowRef()).<FlowCompletion>flatMap(found -> {
            final var flow = requirePending(found, DeviceFlowRecord::status, DeviceFlowRecord::isExpired);
            if (idpError != null) {
                return deviceFlows
                        .replace(flow, flow.withStatus(FlowStatus.DENIED))
                        .<FlowCompletion>flatMap(ignored -> denied(GrantType.DEVICE_CODE, idpError));
            }
            return innerExchange(state, idpCode, DEVICE_CALLBACK_PATH)
                    .onFailure(UpstreamRejectedException.class)
                    .call(() -> deviceFlows.replace(flow, flow.withStatus(FlowStatus.DENIED)))
                    .flatMap(identity -> deviceFlows.replace(flow, flow.authorize(identity)).map(swapped -> {
                        if (!swapped) {
                            throw new ExpiredOrConsumedException("Flow was already completed");
                        }
                        LOG.debugv("Device flow {0} authorized", flow.userCode());
                        return (FlowCompletion) new FlowCompletion.DeviceAuthorized(flow.userCode());
                    }));
        });
    }

    private Uni<IdpIdentity> innerExchange(FlowState state, String idpCode, String callbackPath) {
        if (idpCode == null || idpCode.isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("Missing code"));
        }
        final var idp = scopeResolver.requireVo(state.vo()).idp();
        return idpClient.exchangeCode(idp, idpCode, state.idpCodeVerifier(), config.publicBaseUrl() + callbackPath);
    }

    private <T> Uni<T> denied(GrantType grantType, String idpError) {
        metrics.recordFlowCompleted(grantType.value(), "denied");
        LOG.infov("Identity provider denied {0} flow: {1}", grantType.value(), idpError);
        return Uni.createFrom().failure(new UpstreamRejectedException("Identity provider denied the login: " + idpError));
    }

    @Override
    public Uni<DevicePollResult> pollDevice(DeviceCodeGrant grant) {
        if (grant.deviceCode() == null || grant.deviceCode().isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("Missing device_code"));
        }
        return Uni.createFrom().deferred(() -> {
            requireClient(grant.clientId());
            return deviceFlows.findById(SecureHash.sha256Hex(grant.deviceCode())).<DevicePollResult>flatMap(found -> {
                if (found.isEmpty()) {
                    return Uni.createFrom().item(new DevicePollResult.Expired());
                }
                final var flow = found.get();
                final var now = Instant.now();

                if (flow.status() == FlowStatus.COMPLETED) {
                    return Uni.createFrom().failure(new ExpiredOrConsumedException("Code was already used"));
                }
                if (flow.status() == FlowStatus.DENIED) {
                    return Uni.createFrom().item(new DevicePollResult.Denied());
                }
                if (flow.status() == FlowStatus.EXPIRED || flow.isExpired(now)) {
                    return markExpired(flow).replaceWith((DevicePollResult) new DevicePollResult.Expired());
                }

                final var tooSoon = flow.isPolledTooSoon(now);
                final var polled = flow.polledAt(now);
                return deviceFlows.replace(flow, polled).<DevicePollResult>flatMap(swapped -> {
                    if (tooSoon || !swapped) {
                        return Uni.createFrom().item(new DevicePollResult.SlowDown());
                    }
                    if (polled.status() == FlowStatus.PENDING) {
                        return Uni.createFrom().item(new DevicePollResult.Pending());
                    }
                    return completeDeviceExchange(polled, grant);
                });
            });
        });
    }

    private Uni<DevicePollResult> completeDeviceExchange(DeviceFlowRecord flow, DeviceCodeGrant grant) {
        pkce.verify(flow.codeChallenge(), grant.codeVerifier());
        return deviceFlows.replace(flow, flow.withStatus(FlowStatus.COMPLETED)).<DevicePollResult>flatMap(swapped -> {
            if (!swapped) {
                return Uni.createFrom().failure(new ExpiredOrConsumedException("Code was already used"));
            }
            return issueTokens(flow.scope(), flow.identity(), GrantType.DEVICE_CODE)
                    .map(tokens -> (DevicePollResult) new DevicePollResult.Ready(tokens));
        });
    }

    private Uni<Void> markExpired(DeviceFlowRecord flow) {
        if (flow.status() == FlowStatus.EXPIRED) {
            return Uni.createFrom().voidItem();
        }
        return deviceFlows.replace(flow, flow.withStatus(FlowStatus.EXPIRED)).replaceWithVoid();
    }

    @Override
    public Uni<IssuedTokens> exchange(AuthorizationCodeGrant grant) {
        if (grant.code() == null || grant.code().isBlank()) {
            return Uni.createFrom().failure(new InvalidRequestException("Missing code"));
        }
        return authorizationFlows.findByCodeHash(SecureHash.sha256Hex(grant.code())).<IssuedTokens>flatMap(found -> {
            final var flow = found.orElseThrow(() -> new ExpiredOrConsumedException("Invalid authorization code"));
            if (flow.status() == FlowStatus.COMPLETED) {
                throw new ExpiredOrConsumedException("Code was already used");
            }
            if (flow.status() != FlowStatus.AUTHORIZED || flow.isExpired(Instant.now())) {
                throw new ExpiredOrConsumedException("Invalid authorization code");
            }
            if (!flow.clientId().equals(grant.clientId())) {
                throw new InvalidRequestException("client_id does not match the flow");
            }
            if (!flow.redirectUri().equals(grant.redirectUri())) {
                throw new InvalidRequestException("redirect_uri does not match the flow");
            }
            pkce.verify(flow.codeChallenge(), grant.codeVerifier());

            return authorizationFlows.replace(flow, flow.withStatus(FlowStatus.COMPLETED)).<IssuedTokens>flatMap(swapped -> {
                if (!swapped) {
                    return Uni.createFrom().failure(new ExpiredOrConsumedException("Code was already used"));
                }
                return issueTokens(flow.scope(), flow.identity(), GrantType.AUTHORIZATION_CODE);
            });
        });
    }

    private Uni<IssuedTokens> issueTokens(String scope, IdpIdentity idpIdentity, GrantType grantType) {
        final var resolved = scopeResolver.resolve(scope, idpIdentity.subject());
        final var identity = new Identity(
                idpIdentity.subject(), resolved.vo(), resolved.group(), idpIdentity.preferredUsername());
        return tokenIssuer
                .issue(identity, resolved, LifetimeClass.USER, CredentialKind.USER, TokenExtras.NONE)
                .invoke(tokens -> {
                    metrics.recordTokensIssued(CredentialKind.USER, grantType.value());
                    metrics.recordFlowCompleted(grantType.value(), "completed");
                    LOG.infov(
                            "Issued tokens via {0} for {1}",
                            grantType.value(), SecureHash.truncatedSha256(identity.principal(), 12));
                });
    }

    @Override
    public Uni<Integer> purgeExpired() {
        final var now = Instant.now();
        return Uni.combine()
                .all()
                .unis(authorizationFlows.purgeExpired(now), deviceFlows.purgeExpired(now))
                .asTuple()
                .map(t -> t.getItem1() + t.getItem2());
    }

    private Uni<String> idpRedirect(GrantType grantType, String flowRef, String vo, String callbackPath) {
        final var idp = scopeResolver.requireVo(vo).idp();
        final var verifier = pkce.generateVerifier();
        final var state = stateCipher.encrypt(new FlowState(
                grantType, flowRef, vo, verifier, Instant.now().truncatedTo(ChronoUnit.SECONDS).getEpochSecond()));
        return idpClient.authorizationEndpoint(idp).map(endpoint -> endpoint
                + (endpoint.contains("?") ? "&" : "?")
                + "response_type=code"
                + "&client_id=" + encode(idp.clientId())
                + "&redirect_uri=" + encode(config.publicBaseUrl() + callbackPath)
                + "&scope=" + encode(IDP_SCOPE)
                + "&state=" + encode(state)
                + "&code_challenge=" + pkce.challengeFor(verifier)
                + "&code_challenge_method=" + PkceVerifier.S256_METHOD);
    }

    private static String clientRedirect(AuthorizationFlowRecord flow, String code) {
        final var sb = new StringBuilder(flow.redirectUri())
                .append(flow.redirectUri().contains("?") ? '&' : '?')
                .append("code=")
                .append(encode(code));
        if (flow.externalState() != null) {
            sb.append("&state=").append(encode(flow.externalState()));
        }
        return sb.toString();
    }

    private void requireClient(String clientId) {
        if (!config.clientId().equals(clientId)) {
            throw new InvalidRequestException("Unrecognised client_id: " + clientId);
        }
    }

    private Duration maxFlowLifetime() {
        final var auth = config.authorizationFlowLifetime();
        final var device = config.deviceFlowLifetime();
        return auth.compareTo(device) >= 0 ? auth : device;
    }

    private static <T> T requirePending(
            Optional<T> found,
            Function<T, FlowStatus> status,
            BiPredicate<T, Instant> expired) {
        return found.filter(f -> status.apply(f) == FlowStatus.PENDING && !expired.test(f, Instant.now()))
                .orElseThrow(() -> new ExpiredOrConsumedException("Flow has expired or was already completed"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
