package com.example.tripstate.config;

import com.example.tripstate.backend.MockBackend;
import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.directions.DirectionsRoute;
import com.example.tripstate.directions.DirectionsService;
import com.example.tripstate.feasibility.FeasibilityCache;
import com.example.tripstate.feasibility.FeasibilityReport;
import com.example.tripstate.imagery.ImageryService;
import com.example.tripstate.refresh.CoalescingRefreshStrategy;
import com.example.tripstate.refresh.NaiveRefreshStrategy;
import com.example.tripstate.refresh.RefreshStrategy;
import com.example.tripstate.refresh.SupersedingFetcher;
import com.example.tripstate.speculative.SpeculativeJobTracker;
import com.example.tripstate.speculative.SpeculativeOrchestrator;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the caches, the speculative tracker and their collaborators. Every component
 * gets its state handed in explicitly; nothing is a static singleton.
 */
@Configuration
public class TripStateBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs background fetches and speculative generation. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backgroundExecutor(@Value("${background.threads:16}") int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads));
    }

    @Bean
    public MockBackend mockBackend(@Value("${backend.latency-ms:200}") long latencyMs) {
        return new MockBackend(latencyMs);
    }

    @Bean
    public SpeculativeJobTracker speculativeJobTracker(
        Clock clock,
        @Value("${speculative.score-threshold:80}") int scoreThreshold,
        @Value("${speculative.max-days:3}") int maxDays,
        @Value("${speculative.retention-ttl-ms:600000}") long retentionTtlMs
    ) {
        return new SpeculativeJobTracker(clock, scoreThreshold, maxDays, Duration.ofMillis(retentionTtlMs));
    }

    @Bean
    public SpeculativeOrchestrator speculativeOrchestrator(
        SpeculativeJobTracker tracker,
        MockBackend backend,
        ExecutorService backgroundExecutor,
        Clock clock,
        @Value("${speculative.cache.max-entries:1000}") int maxEntries,
        @Value("${speculative.retention-ttl-ms:600000}") long retentionTtlMs,
        @Value("${speculative.await-timeout-ms:10000}") long awaitTimeoutMs
    ) {
        BoundedCache<Long, List<String>> days =
            new BoundedCache<>(maxEntries, Duration.ofMillis(retentionTtlMs), clock);
        return new SpeculativeOrchestrator(
            tracker, backend, backgroundExecutor, days, Duration.ofMillis(awaitTimeoutMs));
    }

    @Bean
    public DirectionsService directionsService(
        MockBackend backend,
        Clock clock,
        @Value("${directions.cache.max-entries:500}") int maxEntries,
        @Value("${directions.cache.ttl-ms:86400000}") long ttlMs,
        @Value("${directions.cache.coalesce:true}") boolean coalesce
    ) {
        BoundedCache<String, DirectionsRoute> cache = new BoundedCache<>(maxEntries, Duration.ofMillis(ttlMs), clock);
        return new DirectionsService(backend, cache, refreshStrategy(coalesce));
    }

    @Bean
    public ImageryService imageryService(
        MockBackend backend,
        Clock clock,
        ExecutorService backgroundExecutor,
        @Value("${imagery.cache.max-entries:500}") int maxEntries,
        @Value("${imagery.cache.ttl-ms:86400000}") long ttlMs,
        @Value("${imagery.cache.coalesce:true}") boolean coalesce
    ) {
        BoundedCache<String, String> cache = new BoundedCache<>(maxEntries, Duration.ofMillis(ttlMs), clock);
        return new ImageryService(
            backend, cache, refreshStrategy(coalesce), new SupersedingFetcher<>(cache, backgroundExecutor));
    }

    @Bean
    public FeasibilityCache feasibilityCache(
        Clock clock,
        @Value("${feasibility.cache.max-entries:1000}") int maxEntries,
        @Value("${feasibility.cache.ttl-ms:86400000}") long ttlMs
    ) {
        BoundedCache<String, FeasibilityReport> cache =
            new BoundedCache<>(maxEntries, Duration.ofMillis(ttlMs), clock);
        return new FeasibilityCache(cache);
    }

    private static <K, V> RefreshStrategy<K, V> refreshStrategy(boolean coalesce) {
        return coalesce ? new CoalescingRefreshStrategy<>() : new NaiveRefreshStrategy<>();
    }
}
