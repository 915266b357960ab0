package leakybucket.adapter.out.bucket;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import leakybucket.adapter.out.bucket.memory.InMemoryBucketStorage;
import leakybucket.adapter.out.bucket.memory.InMemoryBucketStorageProvider;
import leakybucket.adapter.out.storage.redis.RedisBucketStorageProvider;
import leakybucket.adapter.out.telemetry.MicrometerBucketMetrics;
import leakybucket.adapter.out.telemetry.NoOpBucketMetrics;
import leakybucket.config.BucketStorageConfig;
import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.BucketStorage;
import leakybucket.spi.BucketStorageProvider;
import leakybucket.spi.StorageProviderException;

/**
 * CDI producer for the bucket storage.
 *
 * <p>Selects the backend named by {@code leakybucket.storage.backend}:
 * <ul>
 *   <li>{@code MEMORY} - in-process buckets (default)</li>
 *   <li>{@code REDIS} - buckets shared across processes through Redis</li>
 * </ul>
 *
 * <p>There is no fallback between backends: a configured backend that cannot be
 * initialized fails startup with a {@link StorageProviderException}.
 */
@ApplicationScoped
public class BucketStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(BucketStorageProviderLoader.class);

    private final BucketStorageConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<MeterRegistry> meterRegistry;
    private final Clock clock;

    @Inject
    public BucketStorageProviderLoader(
            BucketStorageConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry) {
        this(config, redisDataSource, meterRegistry, Clock.systemUTC());
    }

    BucketStorageProviderLoader(
            BucketStorageConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry,
            Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Produces the bucket storage instance for CDI injection.
     *
     * @return the configured bucket storage
     */
    @Produces
    @ApplicationScoped
    public BucketStorage produceBucketStorage() {
        final var provider = selectProvider();
        if (!provider.isAvailable()) {
            throw new StorageProviderException(
                    "Bucket storage provider " + provider.name() + " is configured but not available");
        }

        LOG.infov("Using bucket storage provider: {0}", provider.name());
        return provider.createStorage();
    }

    /**
     * Disposes the bucket storage, shutting down any cleanup executors.
     */
    void disposeBucketStorage(@Disposes BucketStorage storage) {
        if (storage instanceof InMemoryBucketStorage inMemory) {
            inMemory.shutdown();
        }
    }

    BucketStorageProvider selectProvider() {
        final var metrics = createMetrics();
        return switch (config.backend()) {
            case MEMORY -> new InMemoryBucketStorageProvider(
                    clock, config.memory().idleRetention(), config.memory().cleanupInterval(), metrics);
            case REDIS -> new RedisBucketStorageProvider(
                    resolveRedisDataSource(),
                    config.redis().keyPrefix(),
                    config.redis().operationTimeout(),
                    clock,
                    metrics);
        };
    }

    private ReactiveRedisDataSource resolveRedisDataSource() {
        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis bucket storage configured but ReactiveRedisDataSource not available");
            return null;
        }
        return redisDataSource.get();
    }

    private BucketMetrics createMetrics() {
        if (!config.metrics().enabled()) {
            LOG.debug("Bucket metrics disabled in configuration");
            return NoOpBucketMetrics.getInstance();
        }
        if (!meterRegistry.isResolvable()) {
            LOG.debug("No MeterRegistry available, bucket metrics disabled");
            return NoOpBucketMetrics.getInstance();
        }
        return new MicrometerBucketMetrics(meterRegistry.get());
    }
}
