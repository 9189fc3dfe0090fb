package com.example.tripstate.eviction;

import com.example.tripstate.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Recency bookkeeping for a {@link com.example.tripstate.core.BoundedCache}.
 * Implementations are not thread-safe; the owning cache calls them under its lock.
 */
public interface EvictionStrategy<K> {
    void onHit(K key);
    void onInsert(K key);
    void onRemove(K key);
    Optional<K> selectVictim(Map<K, ? extends CacheEntry<?>> store);
    void clear();
}
