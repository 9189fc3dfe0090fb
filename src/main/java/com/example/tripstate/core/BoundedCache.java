package com.example.tripstate.core;

import com.example.tripstate.eviction.EvictionStrategy;
import com.example.tripstate.eviction.LruEvictionStrategy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * Fixed-capacity key/value store with least-recently-used eviction and optional
 * time-to-live.
 *
 * <p>The entry count never exceeds {@code maxSize}. Once an entry is older than
 * {@code ttl} (measured from its last write) no accessor returns it; expired entries
 * are deleted lazily when a read or a traversal runs into them.
 *
 * <p>Thread-safe: every operation runs under a single lock, so "check, evict, insert"
 * is atomic. Concurrent misses for the same key are not deduplicated here, see
 * {@link com.example.tripstate.refresh.CoalescingRefreshStrategy} for that.
 *
 * @param <K> key type, must have stable equals/hashCode
 * @param <V> value type
 */
public class BoundedCache<K, V> {

    private final ReentrantLock lock = new ReentrantLock();

    // insertion ordered, traversals report entries oldest write first
    private final Map<K, CacheEntry<V>> store = new LinkedHashMap<>();
    private final EvictionStrategy<K> evictionStrategy;
    private final int maxSize;
    private final Long ttlMillis;
    private final Clock clock;

    private long evictions;

    public BoundedCache(int maxSize) {
        this(maxSize, null);
    }

    public BoundedCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, Clock.systemUTC(), new LruEvictionStrategy<>());
    }

    public BoundedCache(int maxSize, Duration ttl, Clock clock) {
        this(maxSize, ttl, clock, new LruEvictionStrategy<>());
    }

    /**
     * @param maxSize          maximum number of entries, at least 1
     * @param ttl              maximum entry age, {@code null} for no expiry
     * @param clock            time source for entry timestamps
     * @param evictionStrategy picks the victim when a new key arrives at capacity
     * @throws CacheConfigurationException if {@code maxSize < 1} or {@code ttl} is not positive
     */
    public BoundedCache(int maxSize, Duration ttl, Clock clock, EvictionStrategy<K> evictionStrategy) {
        if (maxSize < 1) {
            throw new CacheConfigurationException("maxSize must be at least 1, got " + maxSize);
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new CacheConfigurationException("ttl must be positive or null, got " + ttl);
        }
        this.maxSize = maxSize;
        this.ttlMillis = ttl == null ? null : ttl.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy, "evictionStrategy is required");
    }

    /**
     * Returns the value for {@code key} and marks it as most recently used.
     * An expired entry is deleted and reported as absent.
     */
    public Optional<V> get(K key) {
        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> entry = liveEntry(key, now);
            if (entry == null) {
                return Optional.empty();
            }
            entry.touch(now);
            evictionStrategy.onHit(key);
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or rewrites {@code key}. A rewrite resets both timestamps and leaves the
     * size unchanged; a new key at capacity first evicts the least recently used entry.
     *
     * @return this cache, for chaining
     */
    public BoundedCache<K, V> set(K key, V value) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");

        lock.lock();
        try {
            long now = clock.millis();
            CacheEntry<V> existing = store.get(key);
            if (existing != null) {
                existing.rewrite(value, now);
                evictionStrategy.onInsert(key);
                return this;
            }

            if (store.size() >= maxSize) {
                evictionStrategy
                    .selectVictim(store)
                    .ifPresent(this::evict);
            }

            store.put(key, new CacheEntry<>(value, now));
            evictionStrategy.onInsert(key);
            return this;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Liveness check without touching recency. Deletes the entry if it has expired.
     */
    public boolean has(K key) {
        lock.lock();
        try {
            return liveEntry(key, clock.millis()) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(K key) {
        lock.lock();
        try {
            if (store.remove(key) == null) {
                return false;
            }
            evictionStrategy.onRemove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            store.clear();
            evictionStrategy.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Raw entry count. May still include expired entries nobody has looked at yet.
     */
    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public Optional<Duration> ttl() {
        return ttlMillis == null ? Optional.empty() : Optional.of(Duration.ofMillis(ttlMillis));
    }

    /** Number of entries removed to make room for new keys since construction. */
    public long evictionCount() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    public List<K> keys() {
        return collectLive((key, entry) -> key);
    }

    public List<V> values() {
        return collectLive((key, entry) -> entry.value);
    }

    public List<Map.Entry<K, V>> entries() {
        return collectLive((key, entry) -> Map.entry(key, entry.value));
    }

    /**
     * Runs {@code action} on a snapshot of the live entries. The action runs outside the
     * cache lock and may call back into the cache.
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Map.Entry<K, V> e : entries()) {
            action.accept(e.getKey(), e.getValue());
        }
    }

    private <R> List<R> collectLive(BiFunction<K, CacheEntry<V>, R> mapper) {
        lock.lock();
        try {
            long now = clock.millis();
            List<R> result = new ArrayList<>(store.size());
            Iterator<Map.Entry<K, CacheEntry<V>>> it = store.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<V>> e = it.next();
                if (!isLive(e.getValue(), now)) {
                    it.remove();
                    evictionStrategy.onRemove(e.getKey());
                    continue;
                }
                result.add(mapper.apply(e.getKey(), e.getValue()));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private CacheEntry<V> liveEntry(K key, long now) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (!isLive(entry, now)) {
            store.remove(key);
            evictionStrategy.onRemove(key);
            return null;
        }
        return entry;
    }

    private boolean isLive(CacheEntry<V> entry, long now) {
        return ttlMillis == null || now - entry.createdAt <= ttlMillis;
    }

    // caller holds the lock
    private void evict(K victim) {
        if (store.remove(victim) != null) {
            evictionStrategy.onRemove(victim);
            evictions++;
        }
    }
}
