package leakybucket.spi;

import leakybucket.core.port.out.BucketStorage;

/**
 * Provider interface for bucket storage backends.
 *
 * <p>Providers are constructed and selected explicitly by
 * {@link leakybucket.adapter.out.bucket.BucketStorageProviderLoader} from
 * configuration. Built-in providers:
 * <ul>
 *   <li>{@code memory} - single process, always available</li>
 *   <li>{@code redis} - shared across processes through Redis</li>
 * </ul>
 *
 * @see leakybucket.core.port.out.BucketStorage
 */
public interface BucketStorageProvider {

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can create a storage
     */
    boolean isAvailable();

    /**
     * Create the bucket storage.
     *
     * <p>Called once during application startup.
     *
     * @return the bucket storage
     * @throws StorageProviderException if the backend cannot be initialized
     */
    BucketStorage createStorage();
}
