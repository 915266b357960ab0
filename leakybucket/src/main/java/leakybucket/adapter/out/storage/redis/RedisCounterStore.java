package leakybucket.adapter.out.storage.redis;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import leakybucket.core.port.out.CounterConnection;
import leakybucket.core.port.out.CounterStore;
import leakybucket.spi.CounterStoreException;

/**
 * Redis-based counter store for distributed bucket storage.
 *
 * <p>Each logical operation borrows one connection from the Quarkus Redis pool
 * through {@link ReactiveRedisDataSource#withConnection}, which returns it to the
 * pool when the operation terminates, on success and on failure alike.
 *
 * <p>The configured timeout bounds the whole logical operation, including the wait
 * for a pooled connection, rather than each command. Failures of individual commands
 * are still logged and counted under the command name.
 *
 * <p>Counters are plain integer strings. Increment and expiry are applied by a single
 * Lua script so that a counter can never be left behind without a time-to-live.
 */
public final class RedisCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(RedisCounterStore.class);

    private static final String NAME = "redis";

    /** Metric and log name for one logical operation, connection wait included. */
    static final String OPERATION = "operation";

    /**
     * Lua script for an atomic increment with expiry.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - increment</li>
     *   <li>ARGV[2] - window duration in milliseconds (for PEXPIRE)</li>
     * </ol>
     *
     * <p>Returns the counter value after the increment.
     */
    static final String INCREMENT_SCRIPT =
            """
            local count = redis.call('INCRBY', KEYS[1], ARGV[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[2])
            end
            return count
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public <T> Uni<T> withConnection(Function<CounterConnection, Uni<T>> operation) {
        final var result = new AtomicReference<T>();
        final Uni<Void> scoped = redisDataSource.withConnection(connected -> operation
                .apply(new RedisCounterConnection(connected))
                .invoke(result::set)
                .replaceWithVoid());
        return timeoutHelper.withDeadline(scoped, OPERATION).map(ignored -> result.get());
    }

    @Override
    public Uni<Void> ping() {
        return timeoutHelper
                .withTimeout(redisDataSource.execute("PING"), "ping")
                .invoke(response -> LOG.debugv("Redis PING answered {0}", response))
                .replaceWithVoid();
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Commands bound to one borrowed connection.
     */
    private final class RedisCounterConnection implements CounterConnection {

        private final ReactiveRedisDataSource connected;

        RedisCounterConnection(ReactiveRedisDataSource connected) {
            this.connected = connected;
        }

        @Override
        public Uni<Long> get(String key) {
            return timeoutHelper
                    .recordingFailures(connected.execute("GET", key), "get")
                    .map(response -> response == null ? null : parseCounter(key, response));
        }

        @Override
        public Uni<Long> incrementWithExpiry(String key, long amount, Duration window) {
            // EVAL script numkeys key [key...] arg [arg...]
            return timeoutHelper
                    .recordingFailures(
                            connected.execute(
                                    "EVAL",
                                    INCREMENT_SCRIPT,
                                    "1", // numkeys
                                    key, // KEYS[1]
                                    String.valueOf(amount), // ARGV[1]
                                    String.valueOf(window.toMillis()) // ARGV[2]
                                    ),
                            "increment")
                    .map(response -> toLong(key, response));
        }

        @Override
        public Uni<Long> ttlMillis(String key) {
            return timeoutHelper
                    .recordingFailures(connected.execute("PTTL", key), "pttl")
                    .map(response -> toLong(key, response));
        }
    }

    private static Long parseCounter(String key, Response response) {
        final var raw = response.toString();
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CounterStoreException("Malformed counter value for key " + key + ": " + raw, e);
        }
    }

    private static long toLong(String key, Response response) {
        if (response == null) {
            throw new CounterStoreException("Null response from Redis for key " + key);
        }
        return response.toLong();
    }
}
