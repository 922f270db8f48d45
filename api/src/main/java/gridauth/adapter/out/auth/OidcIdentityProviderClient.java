package gridauth.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import gridauth.core.config.IdpConfig;
import gridauth.core.exception.AuthException;
import gridauth.core.exception.UpstreamRejectedException;
import gridauth.core.exception.UpstreamUnavailableException;
import gridauth.core.model.flow.IdpIdentity;
import gridauth.core.model.registry.IdpSettings;
import gridauth.core.port.out.IdentityProviderClient;

/**
 * OpenID Connect client used for the inner authorization code exchange.
 *
 * <p>Features:
 * <ul>
 *   <li>Discovery metadata and JWKS cached in Caffeine with a configurable TTL</li>
 *   <li>Authorization code exchange with a PKCE verifier (RFC 7636)</li>
 *   <li>ID token verification against the IdP JWKS, refreshed once on an unknown key id</li>
 * </ul>
 *
 * <p>Only the ID token claims are used. The IdP access and refresh tokens are dropped.
 *
 * <p>Timeouts, I/O errors and 5xx responses are {@link UpstreamUnavailableException}; the
 * user may retry. A 4xx response or an invalid ID token is {@link UpstreamRejectedException}.
 * Nothing is retried here.
 */
@ApplicationScoped
public class OidcIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(OidcIdentityProviderClient.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    private final WebClient webClient;
    private final IdpConfig config;
    private final Cache<String, IdpMetadata> metadataCache;
    private final Cache<String, JsonWebKeySet> jwksCache;

    @Inject
    public OidcIdentityProviderClient(Vertx vertx, IdpConfig config, MeterRegistry meterRegistry) {
        this(WebClient.create(vertx), config, meterRegistry);
    }

    OidcIdentityProviderClient(WebClient webClient, IdpConfig config, MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.config = config;
        this.metadataCache = Caffeine.newBuilder()
                .maximumSize(config.metadataCacheSize())
                .expireAfterWrite(config.metadataCacheTtl())
                .recordStats()
                .build();
        this.jwksCache = Caffeine.newBuilder()
                .maximumSize(config.metadataCacheSize())
                .expireAfterWrite(config.metadataCacheTtl())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, metadataCache, "gridauth.idp.metadata.cache");
        CaffeineCacheMetrics.monitor(meterRegistry, jwksCache, "gridauth.idp.jwks.cache");
    }

    @Override
    public Uni<String> authorizationEndpoint(IdpSettings idp) {
        return metadata(idp).map(IdpMetadata::authorizationEndpoint);
    }

    @Override
    public Uni<IdpIdentity> exchangeCode(IdpSettings idp, String code, String codeVerifier, String redirectUri) {
        return metadata(idp)
                .flatMap(metadata -> {
                    LOG.debugf("Exchanging authorization code with IdP: %s", metadata.tokenEndpoint());
                    return send(webClient
                                    .postAbs(metadata.tokenEndpoint())
                                    .putHeader("Content-Type", "application/x-www-form-urlencoded")
                                    .putHeader("Accept", "application/json")
                                    .sendBuffer(Buffer.buffer(formBody(idp, code, codeVerifier, redirectUri))),
                                    metadata.tokenEndpoint())
                            .map(response -> idToken(response, metadata))
                            .flatMap(idToken -> verifyIdToken(idToken, idp, metadata));
                });
    }

    private Uni<IdpMetadata> metadata(IdpSettings idp) {
        final var url = idp.serverMetadataUrl();
        final var cached = metadataCache.getIfPresent(url);
        if (cached != null) {
            return Uni.createFrom().item(cached);
        }
        LOG.infov("Fetching IdP metadata from {0}", url);
        return send(webClient.getAbs(url).putHeader("Accept", "application/json").send(), url)
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw new UpstreamUnavailableException(
                                "IdP metadata endpoint returned status " + response.statusCode());
                    }
                    final var metadata = IdpMetadata.from(parseJson(response, "metadata"));
                    metadataCache.put(url, metadata);
                    return metadata;
                });
    }

    private Uni<JsonWebKeySet> jwks(IdpMetadata metadata, boolean forceRefresh) {
        final var url = metadata.jwksUri();
        if (forceRefresh) {
            jwksCache.invalidate(url);
        }
        final var cached = jwksCache.getIfPresent(url);
        if (cached != null) {
            return Uni.createFrom().item(cached);
        }
        LOG.infov("Fetching IdP JWKS from {0}", url);
        return send(webClient.getAbs(url).send(), url).map(response -> {
            if (response.statusCode() != 200) {
                throw new UpstreamUnavailableException("IdP JWKS endpoint returned status " + response.statusCode());
            }
            try {
                final var keySet = new JsonWebKeySet(response.bodyAsString());
                jwksCache.put(url, keySet);
                return keySet;
            } catch (JoseException e) {
                throw new UpstreamUnavailableException("Failed to parse IdP JWKS: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Bound a request by the configured timeout and turn transport failures into
     * {@link UpstreamUnavailableException}.
     */
    private Uni<HttpResponse<Buffer>> send(Uni<HttpResponse<Buffer>> request, String url) {
        return request.ifNoItem()
                .after(config.timeout())
                .failWith(() -> new UpstreamUnavailableException("Timeout calling identity provider at " + url))
                .onFailure(e -> !(e instanceof AuthException))
                .transform(e -> {
                    LOG.warnv("Identity provider call to {0} failed: {1}", url, e.getMessage());
                    return new UpstreamUnavailableException("Identity provider unreachable: " + e.getMessage(), e);
                });
    }

    private String idToken(HttpResponse<Buffer> response, IdpMetadata metadata) {
        final var status = response.statusCode();
        if (status >= 500) {
            LOG.warnf("Token exchange failed with status %d", status);
            throw new UpstreamUnavailableException("Identity provider returned error: " + status);
        }
        if (status != 200) {
            LOG.warnf("Token exchange rejected with status %d: %s", status, response.bodyAsString());
            throw new UpstreamRejectedException("Identity provider rejected the authorization code");
        }
        final var idToken = parseJson(response, "token").getString("id_token");
        if (idToken == null || idToken.isBlank()) {
            throw new UpstreamRejectedException("Identity provider response missing id_token");
        }
        return idToken;
    }

    private Uni<IdpIdentity> verifyIdToken(String idToken, IdpSettings idp, IdpMetadata metadata) {
        final String keyId;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(idToken);
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            return Uni.createFrom().failure(new UpstreamRejectedException("Malformed ID token", e));
        }

        return jwks(metadata, false)
                .flatMap(keySet -> findKey(keySet, keyId)
                        .map(key -> Uni.createFrom().item(key))
                        .orElseGet(() -> {
                            LOG.infov("Key {0} not found, refreshing IdP JWKS", keyId);
                            return jwks(metadata, true).map(refreshed -> findKey(refreshed, keyId)
                                    .orElseThrow(() -> new UpstreamRejectedException("ID token signing key not found")));
                        }))
                .map(key -> validate(idToken, idp, metadata, key));
    }

    private IdpIdentity validate(String idToken, IdpSettings idp, IdpMetadata metadata, JsonWebKey key) {
        try {
            final var claims = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setRequireIssuedAt()
                    .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                    .setExpectedIssuer(metadata.issuer())
                    .setExpectedAudience(idp.clientId())
                    .setVerificationKey(key.getKey())
                    .build()
                    .processToClaims(idToken);
            return new IdpIdentity(
                    claims.getIssuer(), claims.getSubject(), claims.getStringClaimValue("preferred_username"));
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugv("ID token validation failed: {0}", e.getMessage());
            throw new UpstreamRejectedException("Invalid ID token from identity provider", e);
        }
    }

    private static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        if (keyId == null) {
            final var keys = keySet.getJsonWebKeys();
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }
        return keySet.getJsonWebKeys().stream()
                .filter(key -> keyId.equals(key.getKeyId()))
                .findFirst();
    }

    private static JsonObject parseJson(HttpResponse<Buffer> response, String what) {
        try {
            return response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException("Failed to parse IdP " + what + " response", e);
        }
    }

    private static String formBody(IdpSettings idp, String code, String codeVerifier, String redirectUri) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("code_verifier", codeVerifier);
        params.put("redirect_uri", redirectUri);
        params.put("client_id", idp.clientId());
        idp.clientSecret().ifPresent(secret -> params.put("client_secret", secret));
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    record IdpMetadata(String issuer, String authorizationEndpoint, String tokenEndpoint, String jwksUri) {

        static IdpMetadata from(JsonObject json) {
            final var metadata = new IdpMetadata(
                    json.getString("issuer"),
                    json.getString("authorization_endpoint"),
                    json.getString("token_endpoint"),
                    json.getString("jwks_uri"));
            if (metadata.issuer() == null
                    || metadata.authorizationEndpoint() == null
                    || metadata.tokenEndpoint() == null
                    || metadata.jwksUri() == null) {
                throw new UpstreamUnavailableException("IdP metadata is incomplete");
            }
            return metadata;
        }
    }
}
