package leakybucket.adapter.out.bucket.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import leakybucket.core.port.out.Bucket;
import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.BucketStorage;

/**
 * In-memory bucket storage.
 *
 * <p>
 * Keeps one live bucket per name in a concurrent map. Creating and evicting a
 * bucket are atomic per name. Suitable for
 * single-instance deployments or development/testing.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 *
 * <p>
 * Buckets that have not been touched for the idle retention period are evicted
 * by {@link #clean()}, which also runs periodically when a cleanup interval is set.
 */
public final class InMemoryBucketStorage implements BucketStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryBucketStorage.class);

    private static final String NAME = "memory";

    private final ConcurrentMap<String, InMemoryBucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleRetention;
    private final BucketMetrics metrics;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Creates a new in-memory storage.
     *
     * @param clock           source of the current time
     * @param idleRetention   how long a bucket may stay untouched before eviction
     * @param cleanupInterval interval between background sweeps, zero to disable them
     * @param metrics         metrics sink
     */
    public InMemoryBucketStorage(
            Clock clock, Duration idleRetention, Duration cleanupInterval, BucketMetrics metrics) {
        this.clock = clock;
        this.idleRetention = idleRetention;
        this.metrics = metrics;

        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            this.cleanupExecutor = null;
        } else {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "bucket-cleanup");
                t.setDaemon(true);
                return t;
            });
            final var intervalMillis = cleanupInterval.toMillis();
            cleanupExecutor.scheduleAtFixedRate(this::clean, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
        LOG.infov("Initialized in-memory bucket storage (idleRetention={0})", idleRetention);
    }

    @Override
    public Uni<Bucket> create(String name, long capacity, Duration rate) {
        return Uni.createFrom().item(() -> {
            BucketStorage.validate(name, capacity, rate);

            // An existing bucket is touched under the key's lock, so a concurrent
            // clean() sees it as in use.
            final var bucket = buckets.compute(name, (n, existing) -> {
                if (existing != null) {
                    existing.touch();
                    return existing;
                }
                LOG.debugf("Created bucket %s: capacity=%d, rate=%s", n, capacity, rate);
                return new InMemoryBucket(n, capacity, rate, clock, metrics);
            });

            if (bucket.capacity() != capacity || !bucket.rate().equals(rate)) {
                LOG.warnf(
                        "Bucket %s already exists with capacity=%d, rate=%s; ignoring capacity=%d, rate=%s",
                        name, bucket.capacity(), bucket.rate(), capacity, rate);
            }
            return bucket;
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Evicts every bucket that has been idle longer than the retention period.
     *
     * @return the number of buckets evicted
     */
    public int clean() {
        final var cutoff = clock.instant().minus(idleRetention);
        final var removed = new AtomicInteger();

        // Check and removal run under the map's lock for the key.
        for (var name : buckets.keySet()) {
            buckets.computeIfPresent(name, (n, bucket) -> {
                if (bucket.idleSince(cutoff)) {
                    removed.incrementAndGet();
                    return null;
                }
                return bucket;
            });
        }

        if (removed.get() > 0) {
            LOG.debugf("Cleaned up %d idle buckets", removed.get());
        }
        return removed.get();
    }

    /**
     * Returns the current number of tracked buckets.
     *
     * @return the number of buckets
     */
    public int size() {
        return buckets.size();
    }

    /**
     * Shuts down the cleanup executor, if one is running.
     */
    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
