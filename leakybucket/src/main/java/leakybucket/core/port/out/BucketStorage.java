package leakybucket.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Factory for named buckets backed by a particular storage backend.
 *
 * <p>Implementations handle where bucket state lives, whether in process memory
 * or in a shared store, while keeping the same externally observable semantics.
 */
public interface BucketStorage {

    /**
     * Return the bucket registered under a name, creating it on first reference.
     *
     * <p>This operation is idempotent per name. When a bucket already exists, a handle
     * to it is returned with its state reconciled against the backend; the existing
     * window is kept as is.
     *
     * @param name the bucket name
     * @param capacity maximum units per window, must not be negative
     * @param rate the window duration, must be positive
     * @return the bucket
     */
    Uni<Bucket> create(String name, long capacity, Duration rate);

    /**
     * Return the name of this backend for logging and metrics.
     *
     * @return the backend name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Validate arguments common to every {@link #create} implementation.
     *
     * @throws IllegalArgumentException if an argument is out of range
     */
    static void validate(String name, long capacity, Duration rate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("bucket name must not be blank");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative");
        }
        if (rate == null || rate.isNegative() || rate.isZero()) {
            throw new IllegalArgumentException("rate must be a positive duration");
        }
    }
}
