package com.williamcallahan.actdb.persistence;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.actdb.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Bounded in-memory cache of deserialized blobs, keyed by storage key.
 *
 * <p>Concurrent first loads of one key share a single loader invocation; the other callers
 * await the same future. A load that fails is dropped from the cache so the next caller retries.</p>
 */
@Component
public class ActCache {

    private final AsyncCache<String, Object> cache;

    @Autowired
    public ActCache(AppProperties appProperties) {
        this(appProperties.getStorage().getCacheCapacity());
    }

    public ActCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        this.cache = Caffeine.newBuilder()
            .maximumSize(capacity)
            .buildAsync();
    }

    /**
     * Returns the cached value, running the loader on the cache's executor if the key is absent.
     *
     * @param key storage key
     * @param loader loads the value for the key; exceptions complete the future exceptionally
     * @return future completing with the value
     */
    public CompletableFuture<Object> get(String key, Function<String, Object> loader) {
        return cache.get(key, loader);
    }

    /**
     * Returns the value if it is cached and has finished loading successfully.
     *
     * @param key storage key
     * @return the cached value, if any
     */
    public Optional<Object> getIfLoaded(String key) {
        CompletableFuture<Object> future = cache.getIfPresent(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.join());
    }

    public void put(String key, Object value) {
        cache.put(key, CompletableFuture.completedFuture(value));
    }

    public boolean contains(String key) {
        return cache.getIfPresent(key) != null;
    }

    public void invalidate(String key) {
        cache.synchronous().invalidate(key);
    }
}
