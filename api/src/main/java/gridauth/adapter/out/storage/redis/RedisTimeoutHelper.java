package gridauth.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gridauth.spi.StorageProviderException;

/**
 * Applies the configured timeout to Redis operations.
 *
 * <p>The stores hold security state (single-use codes, refresh token status,
 * secret use counts), so every operation is fail-fast: a timeout surfaces as
 * {@link RedisTimeoutException} and is never turned into a default value.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String repositoryName;

    public RedisTimeoutHelper(Duration timeout, String repositoryName) {
        this.timeout = timeout;
        this.repositoryName = repositoryName;
    }

    /**
     * Fail the operation with {@link RedisTimeoutException} if it does not complete in time.
     * Other failures propagate unchanged.
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
            return new RedisTimeoutException(operationName, repositoryName);
        });
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends StorageProviderException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        public String getOperation() {
            return operation;
        }

        public String getRepository() {
            return repository;
        }
    }
}
