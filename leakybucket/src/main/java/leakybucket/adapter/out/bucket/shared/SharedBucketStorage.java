package leakybucket.adapter.out.bucket.shared;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import leakybucket.core.port.out.Bucket;
import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.BucketStorage;
import leakybucket.core.port.out.CounterStore;

/**
 * Bucket storage backed by a shared counter store for multi-process deployments.
 *
 * <p>Nothing durable is held locally: the counter store is the single source of
 * truth and each returned bucket is a view over one remote key. Capacity and rate
 * are not stored remotely, so they are taken from every {@link #create} call.
 *
 * <p>Key format: {@code {keyPrefix}{name}}
 */
public final class SharedBucketStorage implements BucketStorage {

    private static final Logger LOG = Logger.getLogger(SharedBucketStorage.class);

    private final CounterStore store;
    private final String keyPrefix;
    private final Clock clock;
    private final BucketMetrics metrics;

    public SharedBucketStorage(CounterStore store, String keyPrefix, Clock clock, BucketMetrics metrics) {
        this.store = store;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.metrics = metrics;
        LOG.infov("Initialized shared bucket storage on {0} (keyPrefix={1})", store.name(), keyPrefix);
    }

    @Override
    public Uni<Bucket> create(String name, long capacity, Duration rate) {
        try {
            BucketStorage.validate(name, capacity, rate);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        final var key = keyPrefix + name;
        return store.withConnection(connection -> connection.get(key).flatMap(count -> {
            if (count == null) {
                LOG.debugf("Created bucket %s: capacity=%d, rate=%s", name, capacity, rate);
                return Uni.createFrom()
                        .item(newBucket(name, key, capacity, rate, capacity, clock.instant().plus(rate)));
            }

            return connection.ttlMillis(key).map(ttl -> {
                final var remaining = SharedBucket.remainingFor(capacity, count);
                final var reset = SharedBucket.resetFor(clock.instant(), ttl, rate);
                LOG.debugf("Attached to bucket %s: remaining=%d, reset=%s", name, remaining, reset);
                return newBucket(name, key, capacity, rate, remaining, reset);
            });
        }));
    }

    @Override
    public String name() {
        return store.name();
    }

    private Bucket newBucket(
            String name, String key, long capacity, Duration rate, long remaining, Instant reset) {
        return new SharedBucket(name, key, capacity, rate, remaining, reset, store, clock, metrics);
    }
}
