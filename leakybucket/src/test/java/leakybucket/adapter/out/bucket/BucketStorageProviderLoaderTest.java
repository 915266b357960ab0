package leakybucket.adapter.out.bucket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.inject.Instance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import leakybucket.adapter.out.bucket.memory.InMemoryBucketStorage;
import leakybucket.adapter.out.bucket.memory.InMemoryBucketStorageProvider;
import leakybucket.adapter.out.storage.redis.RedisBucketStorageProvider;
import leakybucket.config.BucketStorageConfig;
import leakybucket.config.BucketStorageConfig.Backend;
import leakybucket.spi.StorageProviderException;
import leakybucket.testing.ManualClock;

@DisplayName("BucketStorageProviderLoader")
@ExtendWith(MockitoExtension.class)
class BucketStorageProviderLoaderTest {

    private static final Duration AWAIT = Duration.ofSeconds(1);

    @Mock
    private BucketStorageConfig config;

    @Mock
    private BucketStorageConfig.MemoryConfig memoryConfig;

    @Mock
    private BucketStorageConfig.RedisConfig redisConfig;

    @Mock
    private BucketStorageConfig.MetricsConfig metricsConfig;

    @Mock
    private Instance<ReactiveRedisDataSource> redisDataSource;

    @Mock
    private Instance<MeterRegistry> meterRegistry;

    private ManualClock clock;
    private BucketStorageProviderLoader loader;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        lenient().when(config.memory()).thenReturn(memoryConfig);
        lenient().when(config.redis()).thenReturn(redisConfig);
        lenient().when(config.metrics()).thenReturn(metricsConfig);
        lenient().when(memoryConfig.idleRetention()).thenReturn(Duration.ofHours(1));
        lenient().when(memoryConfig.cleanupInterval()).thenReturn(Duration.ZERO);
        lenient().when(redisConfig.keyPrefix()).thenReturn("leakybucket:");
        lenient().when(redisConfig.operationTimeout()).thenReturn(Duration.ofMillis(100));
        lenient().when(metricsConfig.enabled()).thenReturn(true);
        lenient().when(meterRegistry.isResolvable()).thenReturn(false);
        loader = new BucketStorageProviderLoader(config, redisDataSource, meterRegistry, clock);
    }

    @Nested
    @DisplayName("Provider selection")
    class SelectionTests {

        @Test
        @DisplayName("should select the memory provider")
        void shouldSelectMemoryProvider() {
            when(config.backend()).thenReturn(Backend.MEMORY);

            final var provider = loader.selectProvider();

            assertInstanceOf(InMemoryBucketStorageProvider.class, provider);
            verify(redisDataSource, never()).isResolvable();
        }

        @Test
        @DisplayName("should select the redis provider")
        void shouldSelectRedisProvider() {
            when(config.backend()).thenReturn(Backend.REDIS);
            when(redisDataSource.isResolvable()).thenReturn(false);

            final var provider = loader.selectProvider();

            assertInstanceOf(RedisBucketStorageProvider.class, provider);
            assertEquals("redis", provider.name());
        }
    }

    @Nested
    @DisplayName("produceBucketStorage()")
    class ProduceTests {

        @Test
        @DisplayName("should produce in-memory storage using the injected clock")
        void shouldProduceInMemoryStorage() {
            when(config.backend()).thenReturn(Backend.MEMORY);

            final var storage = loader.produceBucketStorage();
            try {
                assertInstanceOf(InMemoryBucketStorage.class, storage);
                final var bucket = storage.create("api", 5, Duration.ofSeconds(1)).await().atMost(AWAIT);
                assertEquals(clock.instant().plusSeconds(1), bucket.reset());
            } finally {
                loader.disposeBucketStorage(storage);
            }
        }

        @Test
        @DisplayName("should fail when redis is configured without a data source")
        void shouldFailWhenRedisIsNotAvailable() {
            when(config.backend()).thenReturn(Backend.REDIS);
            when(redisDataSource.isResolvable()).thenReturn(false);

            final var error = assertThrows(StorageProviderException.class, loader::produceBucketStorage);

            assertTrue(error.getMessage().contains("redis"));
        }

        @Test
        @DisplayName("should record metrics when a registry is available")
        void shouldRecordMetricsWithRegistry() {
            final var registry = new SimpleMeterRegistry();
            when(config.backend()).thenReturn(Backend.MEMORY);
            when(meterRegistry.isResolvable()).thenReturn(true);
            when(meterRegistry.get()).thenReturn(registry);

            final var storage = loader.produceBucketStorage();
            try {
                final var bucket = storage.create("api", 5, Duration.ofSeconds(1)).await().atMost(AWAIT);
                bucket.add(2).await().atMost(AWAIT);
            } finally {
                loader.disposeBucketStorage(storage);
            }

            assertEquals(
                    1.0,
                    registry.get("leakybucket.add.total")
                            .tag("backend", "memory")
                            .tag("outcome", "accepted")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should not touch the registry when metrics are disabled")
        void shouldSkipRegistryWhenMetricsDisabled() {
            when(config.backend()).thenReturn(Backend.MEMORY);
            when(metricsConfig.enabled()).thenReturn(false);

            final var storage = loader.produceBucketStorage();
            loader.disposeBucketStorage(storage);

            verify(meterRegistry, never()).get();
        }
    }
}
