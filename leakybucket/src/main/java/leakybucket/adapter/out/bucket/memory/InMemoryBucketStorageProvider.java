package leakybucket.adapter.out.bucket.memory;

import java.time.Clock;
import java.time.Duration;

import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.BucketStorage;
import leakybucket.spi.BucketStorageProvider;

/**
 * In-memory bucket storage provider.
 *
 * <p>This provider is always available. Configuration is passed during
 * creation via the loader.
 */
public final class InMemoryBucketStorageProvider implements BucketStorageProvider {

    private static final String NAME = "memory";

    private final Clock clock;
    private final Duration idleRetention;
    private final Duration cleanupInterval;
    private final BucketMetrics metrics;

    /**
     * Create a new in-memory provider with configuration.
     *
     * @param clock source of the current time
     * @param idleRetention how long a bucket may stay untouched before eviction
     * @param cleanupInterval interval between background sweeps, zero to disable them
     * @param metrics metrics sink
     */
    public InMemoryBucketStorageProvider(
            Clock clock, Duration idleRetention, Duration cleanupInterval, BucketMetrics metrics) {
        this.clock = clock;
        this.idleRetention = idleRetention;
        this.cleanupInterval = cleanupInterval;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public BucketStorage createStorage() {
        return new InMemoryBucketStorage(clock, idleRetention, cleanupInterval, metrics);
    }
}
