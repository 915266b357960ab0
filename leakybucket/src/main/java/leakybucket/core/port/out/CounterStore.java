package leakybucket.core.port.out;

import java.util.function.Function;

import io.smallrye.mutiny.Uni;

/**
 * Port for a remote store of integer counters with expiry.
 *
 * <p>The store lends out one connection per logical operation. The connection is
 * released when the Uni returned by the operation terminates, whether it succeeds
 * or fails.
 */
public interface CounterStore {

    /**
     * Run an operation against a single borrowed connection.
     *
     * @param operation the commands to run on the connection
     * @param <T> the result type
     * @return the result of the operation
     */
    <T> Uni<T> withConnection(Function<CounterConnection, Uni<T>> operation);

    /**
     * Check that the store is reachable.
     *
     * @return completion signal, failing if the store cannot be reached
     */
    Uni<Void> ping();

    /**
     * Return the name of the store for logging.
     *
     * @return the store name
     */
    String name();
}
