package leakybucket.core.port.out;

/**
 * Port for recording bucket and store metrics.
 */
public interface BucketMetrics {

    /**
     * Record the outcome of an add.
     *
     * @param backend the storage backend name
     * @param accepted true if the units were consumed, false if the bucket was full
     */
    void recordAdd(String backend, boolean accepted);

    /**
     * Record a remote store operation that exceeded its timeout.
     *
     * @param operation the operation name
     */
    void recordStoreTimeout(String operation);

    /**
     * Record a remote store operation that failed.
     *
     * @param operation the operation name
     */
    void recordStoreFailure(String operation);
}
