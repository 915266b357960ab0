package leakybucket.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import leakybucket.adapter.out.bucket.shared.SharedBucketStorage;
import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.BucketStorage;
import leakybucket.spi.BucketStorageProvider;
import leakybucket.spi.StorageProviderException;

/**
 * Redis-based bucket storage provider for distributed deployments.
 *
 * <p>Availability depends on a Redis data source being configured in the
 * application. Creating the storage pings Redis so that an unreachable server
 * is reported at startup rather than on the first bucket operation.
 */
public final class RedisBucketStorageProvider implements BucketStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisBucketStorageProvider.class);

    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;
    private final Duration operationTimeout;
    private final Clock clock;
    private final BucketMetrics metrics;

    /**
     * Creates a new Redis provider with configuration.
     *
     * @param redisDataSource the Redis data source (may be null when Redis is not configured)
     * @param keyPrefix prefix for bucket counter keys
     * @param operationTimeout upper bound for one Redis operation
     * @param clock source of the current time
     * @param metrics metrics sink
     */
    public RedisBucketStorageProvider(
            ReactiveRedisDataSource redisDataSource,
            String keyPrefix,
            Duration operationTimeout,
            Clock clock,
            BucketMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
        this.operationTimeout = operationTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public BucketStorage createStorage() {
        if (redisDataSource == null) {
            throw new StorageProviderException("Redis bucket storage requested but no Redis data source is configured");
        }

        final var store = new RedisCounterStore(redisDataSource, new RedisTimeoutHelper(operationTimeout, metrics));
        try {
            // Fail fast on an invalid address: pooled connections only report errors once a command is sent.
            store.ping().await().atMost(operationTimeout.multipliedBy(2));
        } catch (RuntimeException e) {
            throw new StorageProviderException("Redis is not reachable: " + e.getMessage(), e);
        }
        LOG.info("Redis reachable, using shared bucket storage");

        return new SharedBucketStorage(store, keyPrefix, clock, metrics);
    }
}
