package leakybucket.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import leakybucket.core.model.BucketState;

/**
 * A named quota tracker that drains as units are added and refills on a fixed window.
 *
 * <p>The bucket is a fixed-window counter: once the window ends, the next add starts
 * a new window of {@code rate} with the full capacity available. There is no partial
 * refill within a window.
 *
 * <p>The accessors return the last known snapshot and have no side effects. For
 * backends whose authoritative state lives elsewhere, they reflect the state observed
 * by the most recent operation on this handle.
 */
public interface Bucket {

    /**
     * Return the bucket name.
     *
     * @return the name the bucket was created under
     */
    String name();

    /**
     * Return the maximum number of units per window.
     *
     * @return the capacity
     */
    long capacity();

    /**
     * Return the units left in the current window.
     *
     * @return the remaining units
     */
    long remaining();

    /**
     * Return when the current window ends.
     *
     * @return the reset instant
     */
    Instant reset();

    /**
     * Return the last known snapshot of this bucket.
     *
     * @return the current state
     */
    default BucketState state() {
        return new BucketState(capacity(), remaining(), reset());
    }

    /**
     * Attempt to consume units from the bucket.
     *
     * <p>If the current window has elapsed, the window first rolls forward and the
     * bucket refills. If {@code amount} exceeds the remaining units, nothing is consumed
     * and the returned Uni fails with
     * {@link leakybucket.core.model.BucketFullException} carrying the unmodified state.
     *
     * @param amount the number of units to consume, must not be negative
     * @return the state after consumption
     */
    Uni<BucketState> add(long amount);
}
