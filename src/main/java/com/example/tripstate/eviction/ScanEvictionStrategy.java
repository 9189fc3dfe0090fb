package com.example.tripstate.eviction;

import com.example.tripstate.core.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Reference eviction: scans every entry for the oldest {@code accessedAt}.
 * O(n) per eviction and keeps no state of its own, fine for small caches.
 * On equal timestamps the first entry in store iteration order loses.
 */
public class ScanEvictionStrategy<K> implements EvictionStrategy<K> {

    @Override
    public void onHit(K key) {
        // recency lives in CacheEntry.accessedAt
    }

    @Override
    public void onInsert(K key) {
        // no-op
    }

    @Override
    public void onRemove(K key) {
        // no-op
    }

    @Override
    public Optional<K> selectVictim(Map<K, ? extends CacheEntry<?>> store) {
        K oldestKey = null;
        long oldestAccess = Long.MAX_VALUE;
        for (Map.Entry<K, ? extends CacheEntry<?>> e : store.entrySet()) {
            if (e.getValue().accessedAt < oldestAccess) {
                oldestAccess = e.getValue().accessedAt;
                oldestKey = e.getKey();
            }
        }
        return Optional.ofNullable(oldestKey);
    }

    @Override
    public void clear() {
        // no-op
    }
}
