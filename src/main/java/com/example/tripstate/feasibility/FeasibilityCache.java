package com.example.tripstate.feasibility;

import com.example.tripstate.core.BoundedCache;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feasibility reports per passport/destination-country corridor. Visa rules change
 * rarely, so a cached report is served until its TTL runs out.
 */
public class FeasibilityCache {

    private static final Logger log = LoggerFactory.getLogger(FeasibilityCache.class);

    private final BoundedCache<String, FeasibilityReport> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public FeasibilityCache(BoundedCache<String, FeasibilityReport> cache) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
    }

    /**
     * "India" + "Tokyo, Japan" becomes "india:japan": lowercased, trimmed, and the
     * destination reduced to its last comma-separated part.
     */
    public static String corridorKey(String passport, String destination) {
        String normalizedPassport = passport.trim().toLowerCase(Locale.ROOT);
        String[] parts = destination.split(",");
        String country = parts[parts.length - 1].trim().toLowerCase(Locale.ROOT);
        return normalizedPassport + ":" + country;
    }

    public Optional<FeasibilityReport> get(String passport, String destination) {
        String key = corridorKey(passport, destination);
        Optional<FeasibilityReport> report = cache.get(key);
        if (report.isPresent()) {
            hits.incrementAndGet();
            log.debug("Feasibility hit: {}", key);
        } else {
            misses.incrementAndGet();
        }
        return report;
    }

    public void put(String passport, String destination, FeasibilityReport report) {
        String key = corridorKey(passport, destination);
        cache.set(key, report);
        log.debug("Feasibility cached: {} (score {})", key, report.score());
    }

    /** Pre-populates well-known corridors, typically at startup. */
    public void warm(List<Corridor> corridors) {
        for (Corridor corridor : corridors) {
            put(corridor.passport(), corridor.destination(), corridor.report());
        }
        log.info("Feasibility cache warmed with {} corridors", corridors.size());
    }

    public void clear() {
        cache.clear();
        hits.set(0);
        misses.set(0);
    }

    public FeasibilityCacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        String hitRate = total == 0
            ? "0%"
            : String.format(Locale.ROOT, "%.1f%%", h * 100.0 / total);
        return new FeasibilityCacheStats(h, m, cache.evictionCount(), cache.size(), hitRate);
    }

    public record Corridor(String passport, String destination, FeasibilityReport report) {}

    /**
     * @param hits      lookups served from cache
     * @param misses    lookups not found or expired
     * @param evictions entries dropped for capacity
     * @param size      entries currently held
     * @param hitRate   hits over lookups, formatted like "66.7%"
     */
    public record FeasibilityCacheStats(long hits, long misses, long evictions, int size, String hitRate) {}
}
