package com.example.tripstate.refresh;

import com.example.tripstate.core.BoundedCache;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * At most one load per key at a time. The first thread to miss runs the loader;
 * threads missing on the same key meanwhile wait for its result.
 */
public class CoalescingRefreshStrategy<K, V> implements RefreshStrategy<K, V> {

    private static final Logger log = LoggerFactory.getLogger(CoalescingRefreshStrategy.class);

    private final ConcurrentHashMap<K, CompletableFuture<Optional<V>>> inFlight = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(
        K key,
        Supplier<? extends V> recomputeFn,
        BoundedCache<K, V> cache
    ) throws Exception {

        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return cached;
        }

        CompletableFuture<Optional<V>> mine = new CompletableFuture<>();
        CompletableFuture<Optional<V>> leader = inFlight.putIfAbsent(key, mine);
        if (leader != null) {
            log.debug("Joining in-flight load: {}", key);
            return await(leader);
        }

        try {
            // another leader may have finished between our miss and claiming the slot
            Optional<V> value = cache.get(key);
            if (value.isEmpty()) {
                log.debug("Cache miss: {}", key);
                V loaded = recomputeFn.get();
                if (loaded != null) {
                    cache.set(key, loaded);
                }
                value = Optional.ofNullable(loaded);
            }
            mine.complete(value);
            return value;
        } catch (Throwable t) {
            mine.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Number of keys currently being loaded. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private Optional<V> await(CompletableFuture<Optional<V>> leader) throws Exception {
        try {
            return leader.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }
}
