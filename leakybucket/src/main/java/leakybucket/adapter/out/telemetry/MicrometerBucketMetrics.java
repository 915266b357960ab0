package leakybucket.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import leakybucket.core.port.out.BucketMetrics;

/**
 * Records bucket metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code leakybucket.add.total} - Adds by backend and outcome (accepted, rejected)</li>
 *   <li>{@code leakybucket.redis.timeouts.total} - Redis operations that timed out</li>
 *   <li>{@code leakybucket.redis.failures.total} - Redis operations that failed</li>
 * </ul>
 */
public class MicrometerBucketMetrics implements BucketMetrics {

    private final MeterRegistry registry;

    public MicrometerBucketMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordAdd(String backend, boolean accepted) {
        Counter.builder("leakybucket.add.total")
                .description("Bucket add operations")
                .tag("backend", backend)
                .tag("outcome", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String operation) {
        Counter.builder("leakybucket.redis.timeouts.total")
                .description("Redis operations that exceeded their timeout")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String operation) {
        Counter.builder("leakybucket.redis.failures.total")
                .description("Redis operations that failed")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
