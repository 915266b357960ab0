package leakybucket.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a bucket returned from every mutating operation.
 *
 * @param capacity maximum number of units the bucket holds per window
 * @param remaining units still available in the current window
 * @param reset the instant at which the current window ends and the bucket refills
 */
public record BucketState(long capacity, long remaining, Instant reset) {

    /**
     * Creates a bucket state with validation.
     */
    public BucketState {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative");
        }
        if (remaining < 0 || remaining > capacity) {
            throw new IllegalArgumentException("remaining must be between 0 and capacity");
        }
        Objects.requireNonNull(reset, "reset must not be null");
    }

    /**
     * Returns true when no units are left in the current window.
     *
     * @return true if the bucket is drained
     */
    public boolean isEmpty() {
        return remaining == 0;
    }
}
