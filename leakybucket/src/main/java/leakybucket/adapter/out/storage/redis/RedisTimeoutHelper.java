package leakybucket.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import leakybucket.core.port.out.BucketMetrics;

/**
 * Helper for applying timeouts and failure accounting to Redis operations.
 *
 * <p>Bucket operations fail fast: a timeout becomes a {@link RedisTimeoutException}
 * and any other failure (connection errors, server errors, malformed values) is
 * propagated unchanged. Nothing is retried and nothing falls back to a default, so
 * callers always see infrastructure failures.
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code leakybucket.redis.timeouts.total}) and
 * other failures ({@code leakybucket.redis.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final BucketMetrics metrics;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts and failures (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, BucketMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Apply the timeout to an operation and account for its failures.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return withDeadline(recordingFailures(operation, operationName), operationName);
    }

    /**
     * Log and count failures of one command without bounding its duration.
     *
     * <p>Used for commands that run inside an operation already bounded by
     * {@link #withDeadline}.
     *
     * @param operation the Redis command
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that propagates every failure unchanged
     */
    public <T> Uni<T> recordingFailures(Uni<T> operation, String operationName) {
        return operation.onFailure().invoke(error -> {
            LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
            recordFailure(operationName);
        });
    }

    /**
     * Bound an operation by the timeout without counting its failures.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout
     */
    public <T> Uni<T> withDeadline(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
            recordTimeout(operationName);
            return new RedisTimeoutException(operationName, timeout);
        });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     *
     * <p>Thrown by {@link #withTimeout} when an operation exceeds the configured timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final Duration timeout;

        public RedisTimeoutException(String operation, Duration timeout) {
            super("Redis operation timeout: " + operation + " after " + timeout);
            this.operation = operation;
            this.timeout = timeout;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the timeout that was exceeded. */
        public Duration getTimeout() {
            return timeout;
        }
    }
}
