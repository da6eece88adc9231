package com.chunkvault.core.config;

import com.chunkvault.core.cache.CacheConfig;
import com.chunkvault.core.content.ContentStoreConfig;
import com.chunkvault.core.queue.WriteQueueConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Builds the engine's configuration records from {@code chunkvault.*} properties.
 */
@ApplicationScoped
public class StorageEngineConfigProducer {

    private static final Logger log = Logger.getLogger(StorageEngineConfigProducer.class);

    @ConfigProperty(name = "chunkvault.cache.max-size-bytes", defaultValue = "104857600")
    long cacheMaxSizeBytes;

    @ConfigProperty(name = "chunkvault.cache.max-items", defaultValue = "0")
    int cacheMaxItems;

    @ConfigProperty(name = "chunkvault.cache.ttl", defaultValue = "5M")
    Duration cacheTtl;

    @ConfigProperty(name = "chunkvault.content.metadata-cache-entries", defaultValue = "1000")
    int metadataCacheEntries;

    @ConfigProperty(name = "chunkvault.content.verify-on-dedup", defaultValue = "false")
    boolean verifyOnDedup;

    @ConfigProperty(name = "chunkvault.content.gc-progress-interval", defaultValue = "25")
    int gcProgressInterval;

    @ConfigProperty(name = "chunkvault.queue.max-size", defaultValue = "1000")
    int queueMaxSize;

    @ConfigProperty(name = "chunkvault.queue.normal-batch-interval", defaultValue = "100ms")
    Duration normalBatchInterval;

    @ConfigProperty(name = "chunkvault.queue.low-idle-delay", defaultValue = "500ms")
    Duration lowIdleDelay;

    @ConfigProperty(name = "chunkvault.queue.low-batch-size", defaultValue = "10")
    int lowBatchSize;

    @ConfigProperty(name = "chunkvault.queue.retry-base-delay", defaultValue = "100ms")
    Duration retryBaseDelay;

    @ConfigProperty(name = "chunkvault.queue.shutdown-timeout", defaultValue = "30s")
    Duration shutdownTimeout;

    @Produces
    @Singleton
    CacheConfig cacheConfig() {
        CacheConfig config = new CacheConfig(cacheMaxSizeBytes, cacheMaxItems, cacheTtl);
        log.debugf("Cache config: %s", config);
        return config;
    }

    @Produces
    @Singleton
    ContentStoreConfig contentStoreConfig() {
        return new ContentStoreConfig(metadataCacheEntries, verifyOnDedup, gcProgressInterval);
    }

    @Produces
    @Singleton
    WriteQueueConfig writeQueueConfig() {
        WriteQueueConfig config = new WriteQueueConfig(queueMaxSize, normalBatchInterval, lowIdleDelay,
                lowBatchSize, retryBaseDelay, shutdownTimeout);
        log.debugf("Write queue config: %s", config);
        return config;
    }
}
