package com.example.tripstate.refresh;

import com.example.tripstate.core.BoundedCache;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous cache-guarded fetch where the latest request for a key wins.
 *
 * <p>Starting a fetch for a key cancels the previous in-flight fetch for that key, and
 * {@link #cancel(Object)} cancels one explicitly. A fetch only writes to the cache if it
 * is still the registered in-flight fetch for its key when the loader returns, so a
 * canceled or superseded fetch never writes.
 */
public class SupersedingFetcher<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SupersedingFetcher.class);

    private final BoundedCache<K, V> cache;
    private final Executor executor;
    private final ConcurrentHashMap<K, CompletableFuture<Optional<V>>> inFlight = new ConcurrentHashMap<>();

    public SupersedingFetcher(BoundedCache<K, V> cache, Executor executor) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    /**
     * @return a future holding the cached or freshly loaded value, empty when the loader
     *     returned {@code null}. The future is canceled if a newer fetch or
     *     {@link #cancel(Object)} supersedes it.
     */
    public CompletableFuture<Optional<V>> fetch(K key, Function<? super K, ? extends V> loader) {
        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<Optional<V>> request = new CompletableFuture<>();
        CompletableFuture<Optional<V>> previous = inFlight.put(key, request);
        if (previous != null) {
            log.debug("Superseding in-flight fetch: {}", key);
            previous.cancel(false);
        }

        CompletableFuture
            .supplyAsync(() -> loader.apply(key), executor)
            .whenComplete((value, error) -> settle(key, request, value, error));
        return request;
    }

    /**
     * Cancels the in-flight fetch for {@code key}, if any.
     *
     * @return true if a fetch was canceled
     */
    public boolean cancel(K key) {
        CompletableFuture<Optional<V>> pending = inFlight.remove(key);
        if (pending == null) {
            return false;
        }
        pending.cancel(false);
        log.debug("Canceled fetch: {}", key);
        return true;
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    private void settle(K key, CompletableFuture<Optional<V>> request, V value, Throwable error) {
        // removing our own registration is the commit point, it fails once superseded or canceled
        boolean current = inFlight.remove(key, request);
        if (!current || request.isCancelled()) {
            log.debug("Discarding result of canceled fetch: {}", key);
            return;
        }
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
            request.completeExceptionally(cause);
            return;
        }
        if (value != null) {
            cache.set(key, value);
        }
        request.complete(Optional.ofNullable(value));
    }
}
