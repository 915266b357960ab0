package leakybucket.adapter.out.bucket.shared;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import leakybucket.core.model.BucketFullException;
import leakybucket.core.model.BucketState;
import leakybucket.core.port.out.Bucket;
import leakybucket.core.port.out.BucketMetrics;
import leakybucket.core.port.out.CounterConnection;
import leakybucket.core.port.out.CounterStore;

/**
 * Bucket projected onto a remote counter with expiry.
 *
 * <p>The counter holds the units consumed in the current window and the key's
 * time-to-live is the time left in it. When the key expires the window is over and
 * the next add starts a new one. This object only caches the projection observed by
 * its latest operation; every add re-reads the remote state first.
 */
public final class SharedBucket implements Bucket {

    private final String name;
    private final String key;
    private final long capacity;
    private final Duration rate;
    private final CounterStore store;
    private final Clock clock;
    private final BucketMetrics metrics;
    private final String backend;

    private volatile long remaining;
    private volatile Instant reset;

    SharedBucket(
            String name,
            String key,
            long capacity,
            Duration rate,
            long remaining,
            Instant reset,
            CounterStore store,
            Clock clock,
            BucketMetrics metrics) {
        this.name = name;
        this.key = key;
        this.capacity = capacity;
        this.rate = rate;
        this.remaining = remaining;
        this.reset = reset;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.backend = store.name();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long capacity() {
        return capacity;
    }

    @Override
    public long remaining() {
        return remaining;
    }

    @Override
    public Instant reset() {
        return reset;
    }

    @Override
    public Uni<BucketState> add(long amount) {
        if (amount < 0) {
            return Uni.createFrom().failure(new IllegalArgumentException("amount must be non-negative"));
        }

        return store.withConnection(connection -> connection.get(key).flatMap(count -> {
            remaining = count == null ? capacity : remainingFor(capacity, count);

            if (amount > remaining) {
                return reconcileReset(connection, false).flatMap(ignored -> {
                    metrics.recordAdd(backend, false);
                    return Uni.createFrom().<BucketState>failure(new BucketFullException(state()));
                });
            }

            return connection
                    .incrementWithExpiry(key, amount, rate)
                    .call(total -> reconcileReset(connection, true))
                    .map(total -> {
                        remaining = remainingFor(capacity, total);
                        metrics.recordAdd(backend, true);
                        return state();
                    });
        }));
    }

    /**
     * Refresh the cached reset time from the key's time-to-live. Unless
     * {@code afterIncrement} is set, the read is skipped while the cached value is
     * still in the future. An increment may have opened the window or given the key
     * its expiry, so the live value is always read after one.
     */
    private Uni<Void> reconcileReset(CounterConnection connection, boolean afterIncrement) {
        if (!afterIncrement && reset.isAfter(clock.instant())) {
            return Uni.createFrom().voidItem();
        }
        return connection.ttlMillis(key).invoke(ttl -> reset = resetFor(clock.instant(), ttl, rate)).replaceWithVoid();
    }

    /**
     * Units left when the remote counter reads {@code count}. The counter may exceed
     * capacity under concurrent writers, so it is clamped before subtracting.
     */
    static long remainingFor(long capacity, long count) {
        return capacity - Math.max(0, Math.min(count, capacity));
    }

    /**
     * Reset time implied by a key's time-to-live. A negative value means the key is
     * gone or carries no expiry, in which case a full window is assumed.
     */
    static Instant resetFor(Instant now, long ttlMillis, Duration rate) {
        return ttlMillis >= 0 ? now.plusMillis(ttlMillis) : now.plus(rate);
    }
}
