package com.example.tripstate.refresh;

import com.example.tripstate.core.BoundedCache;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache-aside lookup: serve from {@code cache} when the key is live, otherwise call
 * {@code recomputeFn} and store what it returns. A {@code null} result or a thrown
 * exception is never stored.
 */
public interface RefreshStrategy<K, V> {
    Optional<V> get(
        K key,
        Supplier<? extends V> recomputeFn,
        BoundedCache<K, V> cache
    ) throws Exception;
}
