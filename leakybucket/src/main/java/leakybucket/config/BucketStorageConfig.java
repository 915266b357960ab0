package leakybucket.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for bucket storage.
 *
 * <p>Configuration prefix: {@code leakybucket.storage}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code LEAKYBUCKET_STORAGE_BACKEND} - Backend: MEMORY, REDIS</li>
 *   <li>{@code LEAKYBUCKET_STORAGE_MEMORY_IDLE_RETENTION} - Idle time before an in-memory bucket is evicted</li>
 *   <li>{@code LEAKYBUCKET_STORAGE_REDIS_KEY_PREFIX} - Prefix for Redis counter keys</li>
 * </ul>
 *
 * <p>Redis connection settings use the standard {@code quarkus.redis.*} properties.
 */
@ConfigMapping(prefix = "leakybucket.storage")
public interface BucketStorageConfig {

    /**
     * Storage backend for buckets.
     *
     * @return the backend (default: MEMORY)
     */
    @WithDefault("MEMORY")
    Backend backend();

    /**
     * In-memory backend configuration.
     */
    MemoryConfig memory();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Available storage backends.
     */
    enum Backend {
        MEMORY,
        REDIS
    }

    /**
     * In-memory backend configuration.
     */
    interface MemoryConfig {

        /**
         * How long a bucket may stay untouched before the sweep evicts it.
         *
         * @return idle retention (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration idleRetention();

        /**
         * Interval between background sweeps. Zero disables the background sweep.
         *
         * @return cleanup interval (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration cleanupInterval();
    }

    /**
     * Redis backend configuration.
     */
    interface RedisConfig {

        /**
         * Key prefix for bucket counters in Redis.
         *
         * <p>Allows several applications to share a Redis instance.
         *
         * @return key prefix (default: "leakybucket:")
         */
        @WithDefault("leakybucket:")
        String keyPrefix();

        /**
         * Upper bound for one logical bucket operation against Redis.
         *
         * @return operation timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration operationTimeout();
    }

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {

        /**
         * Record bucket metrics through Micrometer.
         *
         * @return true if metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
