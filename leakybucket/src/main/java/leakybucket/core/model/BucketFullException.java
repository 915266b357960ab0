package leakybucket.core.model;

/**
 * Signals that an add asked for more units than the bucket has left in its current window.
 *
 * <p>This is an expected, caller-recoverable condition rather than an infrastructure
 * failure. The exception carries the bucket state as it was when the add was refused
 * (after any window rollover, before any decrement), so callers can report remaining
 * quota and reset time without a second query.
 */
public class BucketFullException extends RuntimeException {

    private final BucketState state;

    public BucketFullException(BucketState state) {
        super("Bucket full: " + state.remaining() + " of " + state.capacity() + " remaining until " + state.reset());
        this.state = state;
    }

    /** Returns the unmodified bucket state at the time of rejection. */
    public BucketState state() {
        return state;
    }
}
