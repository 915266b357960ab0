package leakybucket.spi;

/**
 * Exception thrown when a counter store returns data that cannot be used,
 * such as a stored value that is not an integer.
 *
 * <p>Treated like any other I/O failure: the current operation fails and
 * nothing is retried.
 */
public class CounterStoreException extends RuntimeException {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
