package leakybucket.adapter.out.bucket.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;

import leakybucket.core.model.BucketFullException;
import leakybucket.core.model.BucketState;
import leakybucket.core.port.out.Bucket;
import leakybucket.core.port.out.BucketMetrics;

/**
 * Bucket whose state lives entirely in this object.
 *
 * <p>Mutations are serialized on the bucket itself, so one instance may be shared
 * across threads.
 */
public final class InMemoryBucket implements Bucket {

    private static final String BACKEND = "memory";

    private final String name;
    private final long capacity;
    private final Duration rate;
    private final Clock clock;
    private final BucketMetrics metrics;

    private long remaining;
    private Instant reset;
    private Instant updated;

    InMemoryBucket(String name, long capacity, Duration rate, Clock clock, BucketMetrics metrics) {
        final var now = clock.instant();
        this.name = name;
        this.capacity = capacity;
        this.rate = rate;
        this.clock = clock;
        this.metrics = metrics;
        this.remaining = capacity;
        this.reset = now.plus(rate);
        this.updated = now;
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
    public synchronized long remaining() {
        return remaining;
    }

    @Override
    public synchronized Instant reset() {
        return reset;
    }

    @Override
    public synchronized BucketState state() {
        return new BucketState(capacity, remaining, reset);
    }

    /**
     * Return the window duration this bucket was created with.
     *
     * @return the rate
     */
    public Duration rate() {
        return rate;
    }

    @Override
    public Uni<BucketState> add(long amount) {
        return Uni.createFrom().item(() -> consume(amount, clock.instant(), false));
    }

    /**
     * Attempt to consume units as if the current time were {@code at}.
     *
     * <p>Used to replay historical events in order. When {@code at} falls in a window
     * older than the current one, the window is re-aligned to start at {@code at}
     * without refilling the bucket.
     *
     * @param amount the number of units to consume, must not be negative
     * @param at the reference time of the event
     * @return the state after consumption
     */
    public Uni<BucketState> addAt(long amount, Instant at) {
        return Uni.createFrom().item(() -> consume(amount, at, true));
    }

    synchronized void touch() {
        updated = clock.instant();
    }

    synchronized boolean idleSince(Instant cutoff) {
        return updated.isBefore(cutoff);
    }

    private synchronized BucketState consume(long amount, Instant now, boolean realign) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be non-negative");
        }

        updated = clock.instant();
        if (!now.isBefore(reset)) {
            reset = now.plus(rate);
            remaining = capacity;
        }
        if (realign && now.isBefore(reset.minus(rate))) {
            reset = now.plus(rate);
        }

        if (amount > remaining) {
            metrics.recordAdd(BACKEND, false);
            throw new BucketFullException(new BucketState(capacity, remaining, reset));
        }

        remaining -= amount;
        metrics.recordAdd(BACKEND, true);
        return new BucketState(capacity, remaining, reset);
    }
}
