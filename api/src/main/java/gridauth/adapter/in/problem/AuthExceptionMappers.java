package gridauth.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import gridauth.core.exception.ExpiredOrConsumedException;
import gridauth.core.exception.InvalidRequestException;
import gridauth.core.exception.InvalidTokenException;
import gridauth.core.exception.PermissionDeniedException;
import gridauth.core.exception.ReplayDetectedException;
import gridauth.core.exception.ServerFaultException;
import gridauth.core.exception.ServiceDisabledException;
import gridauth.core.exception.UpstreamRejectedException;
import gridauth.core.exception.UpstreamUnavailableException;
import gridauth.core.service.auth.KeyRotationService.KeyNotFoundException;
import gridauth.spi.StorageProviderException;

/**
 * Exception mappers converting the {@code AuthException} hierarchy to RFC 7807 Problem Details.
 *
 * <p>Each failure is logged once here. Client errors log at DEBUG; replay and upstream
 * failures log at WARN. Server faults log at ERROR and answer 500 {@code server_error}.
 */
@ApplicationScoped
public class AuthExceptionMappers {

    private static final Logger LOG = Logger.getLogger(AuthExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapInvalidRequest(InvalidRequestException e) {
        LOG.debugv("Invalid request: {0}", e.getMessage());
        return toResponse(AuthProblem.invalidRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapExpiredOrConsumed(ExpiredOrConsumedException e) {
        LOG.debugv("Grant rejected ({0}): {1}", e.getError(), e.getMessage());
        return toResponse(
                switch (e.getError()) {
                    case ExpiredOrConsumedException.INVALID_CLIENT -> AuthProblem.invalidClient(e.getMessage());
                    case ExpiredOrConsumedException.EXPIRED_TOKEN -> AuthProblem.expiredToken(e.getMessage());
                    default -> AuthProblem.invalidGrant(e.getMessage());
                });
    }

    @ServerExceptionMapper
    public Response mapInvalidToken(InvalidTokenException e) {
        LOG.debugv("Invalid token: {0}", e.getMessage());
        return Response.fromResponse(toResponse(AuthProblem.invalidToken(e.getMessage())))
                .header("WWW-Authenticate", "Bearer error=\"invalid_token\"")
                .build();
    }

    @ServerExceptionMapper
    public Response mapReplayDetected(ReplayDetectedException e) {
        LOG.warnv("Refresh token replay rejected, {0} tokens revoked", e.getRevokedCount());
        return toResponse(AuthProblem.replayDetected(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPermissionDenied(PermissionDeniedException e) {
        LOG.debugv("Permission denied: {0}", e.getMessage());
        return toResponse(AuthProblem.accessDenied(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamRejected(UpstreamRejectedException e) {
        LOG.infov("Identity provider rejected the login: {0}", e.getMessage());
        return toResponse(AuthProblem.accessDenied(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamUnavailable(UpstreamUnavailableException e) {
        LOG.warnv("Identity provider unavailable: {0}", e.getMessage());
        return toResponse(AuthProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapServiceDisabled(ServiceDisabledException e) {
        LOG.debugv("Disabled service called: {0}", e.getMessage());
        return toResponse(AuthProblem.serviceUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapServerFault(ServerFaultException e) {
        LOG.errorv(e, "Server fault: {0}", e.getMessage());
        return toResponse(AuthProblem.serverError("The request could not be completed, try again"));
    }

    @ServerExceptionMapper
    public Response mapStorageProvider(StorageProviderException e) {
        LOG.errorv(e, "Storage provider failure: {0}", e.getMessage());
        return toResponse(AuthProblem.serviceUnavailable("Storage temporarily unavailable"));
    }

    @ServerExceptionMapper
    public Response mapKeyNotFound(KeyNotFoundException e) {
        return toResponse(AuthProblem.notFound(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AuthProblem.invalidRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.debugv("State error: {0}", e.getMessage());
        return toResponse(AuthProblem.invalidRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
