package leakybucket.adapter.out.telemetry;

import leakybucket.core.port.out.BucketMetrics;

/**
 * Bucket metrics that record nothing.
 *
 * <p>Used when metrics are disabled or no meter registry is available.
 */
public final class NoOpBucketMetrics implements BucketMetrics {

    private static final NoOpBucketMetrics INSTANCE = new NoOpBucketMetrics();

    private NoOpBucketMetrics() {}

    /**
     * Return the singleton instance.
     *
     * @return the no-op metrics
     */
    public static NoOpBucketMetrics getInstance() {
        return INSTANCE;
    }

    @Override
    public void recordAdd(String backend, boolean accepted) {}

    @Override
    public void recordStoreTimeout(String operation) {}

    @Override
    public void recordStoreFailure(String operation) {}
}
