package leakybucket.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MicrometerBucketMetrics")
class MicrometerBucketMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerBucketMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerBucketMetrics(registry);
    }

    @Test
    @DisplayName("should count adds by backend and outcome")
    void shouldCountAddsByBackendAndOutcome() {
        metrics.recordAdd("memory", true);
        metrics.recordAdd("memory", true);
        metrics.recordAdd("memory", false);
        metrics.recordAdd("redis", false);

        assertEquals(2.0, addCount("memory", "accepted"));
        assertEquals(1.0, addCount("memory", "rejected"));
        assertEquals(1.0, addCount("redis", "rejected"));
    }

    @Test
    @DisplayName("should count Redis timeouts and failures separately")
    void shouldCountTimeoutsAndFailuresSeparately() {
        metrics.recordStoreTimeout("increment");
        metrics.recordStoreFailure("increment");
        metrics.recordStoreFailure("get");

        assertEquals(
                1.0,
                registry.get("leakybucket.redis.timeouts.total")
                        .tag("operation", "increment")
                        .counter()
                        .count());
        assertEquals(
                1.0,
                registry.get("leakybucket.redis.failures.total")
                        .tag("operation", "increment")
                        .counter()
                        .count());
        assertEquals(
                1.0,
                registry.get("leakybucket.redis.failures.total")
                        .tag("operation", "get")
                        .counter()
                        .count());
    }

    private double addCount(String backend, String outcome) {
        return registry.get("leakybucket.add.total")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .counter()
                .count();
    }
}
