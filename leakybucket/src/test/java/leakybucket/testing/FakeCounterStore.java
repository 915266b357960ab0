package leakybucket.testing;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import leakybucket.core.port.out.CounterConnection;
import leakybucket.core.port.out.CounterStore;
import leakybucket.spi.CounterStoreException;

/**
 * Counter store with Redis counter and expiry semantics, driven by a {@link ManualClock}.
 *
 * <p>Tracks borrowed connections so tests can check they are always released, and
 * can be told to fail the next command.
 */
public final class FakeCounterStore implements CounterStore {

    private final ManualClock clock;
    private final Map<String, Entry> entries = new HashMap<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicInteger borrowed = new AtomicInteger();
    private volatile RuntimeException nextFailure;

    public FakeCounterStore(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public <T> Uni<T> withConnection(Function<CounterConnection, Uni<T>> operation) {
        return Uni.createFrom().deferred(() -> {
            openConnections.incrementAndGet();
            borrowed.incrementAndGet();
            return operation.apply(new Connection());
        }).eventually(openConnections::decrementAndGet);
    }

    @Override
    public Uni<Void> ping() {
        return Uni.createFrom().voidItem();
    }

    @Override
    public String name() {
        return "fake";
    }

    /** Stores a raw value without expiry, as a foreign writer would. */
    public synchronized void putRaw(String key, String value) {
        entries.put(key, new Entry(value, null));
    }

    /** Stores a counter with a time-to-live. */
    public synchronized void putCounter(String key, long value, Duration ttl) {
        entries.put(key, new Entry(String.valueOf(value), clock.instant().plus(ttl)));
    }

    public synchronized Long counter(String key) {
        final var entry = live(key);
        return entry == null ? null : Long.parseLong(entry.value());
    }

    public synchronized long ttlOf(String key) {
        return ttl(key);
    }

    public void failNextCommand(RuntimeException failure) {
        this.nextFailure = failure;
    }

    public int openConnections() {
        return openConnections.get();
    }

    public int borrowedConnections() {
        return borrowed.get();
    }

    private Entry live(String key) {
        final var entry = entries.get(key);
        if (entry != null && entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private long ttl(String key) {
        final var entry = live(key);
        if (entry == null) {
            return -2;
        }
        if (entry.expiresAt() == null) {
            return -1;
        }
        return Duration.between(clock.instant(), entry.expiresAt()).toMillis();
    }

    private <T> Uni<T> command(Supplier<T> body) {
        final var failure = nextFailure;
        if (failure != null) {
            nextFailure = null;
            return Uni.createFrom().failure(failure);
        }
        return Uni.createFrom().item(() -> {
            synchronized (FakeCounterStore.this) {
                return body.get();
            }
        });
    }

    private final class Connection implements CounterConnection {

        @Override
        public Uni<Long> get(String key) {
            return command(() -> {
                final var entry = live(key);
                if (entry == null) {
                    return null;
                }
                try {
                    return Long.parseLong(entry.value());
                } catch (NumberFormatException e) {
                    throw new CounterStoreException("Malformed counter value for key " + key, e);
                }
            });
        }

        @Override
        public Uni<Long> incrementWithExpiry(String key, long amount, Duration window) {
            return command(() -> {
                final var entry = live(key);
                final var count = (entry == null ? 0 : Long.parseLong(entry.value())) + amount;
                final Instant expiresAt = entry == null || entry.expiresAt() == null
                        ? clock.instant().plus(window)
                        : entry.expiresAt();
                entries.put(key, new Entry(String.valueOf(count), expiresAt));
                return count;
            });
        }

        @Override
        public Uni<Long> ttlMillis(String key) {
            return command(() -> ttl(key));
        }
    }

    private record Entry(String value, Instant expiresAt) {}
}
