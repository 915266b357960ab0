package leakybucket.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Commands available on a connection borrowed from a {@link CounterStore}.
 *
 * <p>Each command is atomic on the store. No atomicity is implied across commands.
 */
public interface CounterConnection {

    /**
     * Read a counter.
     *
     * <p>Fails with {@link leakybucket.spi.CounterStoreException} when the stored
     * value is not an integer.
     *
     * @param key the counter key
     * @return the counter value, or a null item if the key does not exist
     */
    Uni<Long> get(String key);

    /**
     * Increment a counter and make sure it expires, as one atomic step.
     *
     * <p>If the key has no expiry after the increment (a fresh key, or one left behind
     * without an expiry), its time-to-live is set to {@code window}. An existing expiry
     * is never extended.
     *
     * @param key the counter key
     * @param amount the increment
     * @param window the time-to-live applied when the key has none
     * @return the counter value after the increment
     */
    Uni<Long> incrementWithExpiry(String key, long amount, Duration window);

    /**
     * Read the remaining time-to-live of a key in milliseconds.
     *
     * @param key the counter key
     * @return the time-to-live, {@code -1} if the key has no expiry, {@code -2} if it does not exist
     */
    Uni<Long> ttlMillis(String key);
}
