package com.example.tripstate.refresh;

import com.example.tripstate.core.BoundedCache;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads on the calling thread. Concurrent misses for one key each call the loader.
 */
public class NaiveRefreshStrategy<K, V> implements RefreshStrategy<K, V> {

    private static final Logger log = LoggerFactory.getLogger(NaiveRefreshStrategy.class);

    @Override
    public Optional<V> get(
        K key,
        Supplier<? extends V> recomputeFn,
        BoundedCache<K, V> cache
    ) {
        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return cached;
        }

        log.debug("Cache miss: {}", key);
        V value = recomputeFn.get();
        if (value != null) {
            cache.set(key, value);
        }
        return Optional.ofNullable(value);
    }
}
