package com.example.tripstate.imagery;

import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.refresh.RefreshStrategy;
import com.example.tripstate.refresh.SupersedingFetcher;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hero images for destinations. Remote results are cached per normalized destination;
 * when the remote source has nothing, a static photo of a well-known city is used
 * (not cached).
 */
public class ImageryService {

    private static final Logger log = LoggerFactory.getLogger(ImageryService.class);

    private static final String PHOTO_BASE = "https://images.unsplash.com/";
    private static final Map<String, String> STATIC_FALLBACKS = Map.ofEntries(
        Map.entry("paris", PHOTO_BASE + "photo-1502602898657-3e91760cbb34?w=1600&h=900&fit=crop"),
        Map.entry("london", PHOTO_BASE + "photo-1513635269975-59663e0ac1ad?w=1600&h=900&fit=crop"),
        Map.entry("tokyo", PHOTO_BASE + "photo-1540959733332-eab4deabeeaf?w=1600&h=900&fit=crop"),
        Map.entry("new york", PHOTO_BASE + "photo-1496442226666-8d4d0e62e6e9?w=1600&h=900&fit=crop"),
        Map.entry("dubai", PHOTO_BASE + "photo-1512453979798-5ea266f8880c?w=1600&h=900&fit=crop"),
        Map.entry("singapore", PHOTO_BASE + "photo-1525625293386-3f8f99389edd?w=1600&h=900&fit=crop"),
        Map.entry("sydney", PHOTO_BASE + "photo-1506973035872-a4ec16b8e8d9?w=1600&h=900&fit=crop"),
        Map.entry("rome", PHOTO_BASE + "photo-1552832230-c0197dd311b5?w=1600&h=900&fit=crop"),
        Map.entry("barcelona", PHOTO_BASE + "photo-1583422409516-2895a77efded?w=1600&h=900&fit=crop"),
        Map.entry("bangkok", PHOTO_BASE + "photo-1508009603885-50cf7c579365?w=1600&h=900&fit=crop"),
        Map.entry("bali", PHOTO_BASE + "photo-1537996194471-e657df975ab4?w=1600&h=900&fit=crop"),
        Map.entry("maldives", PHOTO_BASE + "photo-1514282401047-d79a71a590e8?w=1600&h=900&fit=crop")
    );

    private final ImageryClient client;
    private final BoundedCache<String, String> cache;
    private final RefreshStrategy<String, String> refreshStrategy;
    private final SupersedingFetcher<String, String> fetcher;

    public ImageryService(
        ImageryClient client,
        BoundedCache<String, String> cache,
        RefreshStrategy<String, String> refreshStrategy,
        SupersedingFetcher<String, String> fetcher
    ) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.refreshStrategy = Objects.requireNonNull(refreshStrategy, "refreshStrategy is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
    }

    /** "Paris, France" becomes "paris--france". */
    public static String cacheKey(String destination) {
        return destination.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    /** "San Francisco, USA" searches for "San Francisco". */
    static String cityName(String destination) {
        return destination.split(",")[0].trim();
    }

    public Optional<String> imageFor(String destination) {
        Optional<String> remote;
        try {
            remote = refreshStrategy.get(
                cacheKey(destination),
                () -> client.findImageUrl(cityName(destination)),
                cache);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            remote = Optional.empty();
        } catch (Exception e) {
            log.warn("Image lookup failed for {}: {}", destination, e.getMessage());
            remote = Optional.empty();
        }
        return remote.or(() -> staticFallback(destination));
    }

    /**
     * Asynchronous lookup for views that can go away. A newer request for the same
     * destination cancels this one, as does {@link #cancel(String)}; canceled lookups
     * never populate the cache.
     */
    public CompletableFuture<Optional<String>> imageForAsync(String destination) {
        return fetcher
            .fetch(cacheKey(destination), key -> client.findImageUrl(cityName(destination)))
            .thenApply(remote -> remote.or(() -> staticFallback(destination)));
    }

    public boolean cancel(String destination) {
        return fetcher.cancel(cacheKey(destination));
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    /** Exact city match, so "Jerome, Arizona" does not get the Rome photo. */
    static Optional<String> staticFallback(String destination) {
        return Optional.ofNullable(STATIC_FALLBACKS.get(cityName(destination).toLowerCase(Locale.ROOT)));
    }
}
