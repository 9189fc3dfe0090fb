package com.example.tripstate.directions;

import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.refresh.RefreshStrategy;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Route lookups memoized by travel mode and waypoint sequence. A cached route is
 * served as-is for the cache TTL, the remote source is not asked again.
 */
public class DirectionsService {

    private static final Logger log = LoggerFactory.getLogger(DirectionsService.class);

    static final int MAX_WAYPOINTS = 25;

    private final DirectionsClient client;
    private final BoundedCache<String, DirectionsRoute> cache;
    private final RefreshStrategy<String, DirectionsRoute> refreshStrategy;

    public DirectionsService(
        DirectionsClient client,
        BoundedCache<String, DirectionsRoute> cache,
        RefreshStrategy<String, DirectionsRoute> refreshStrategy
    ) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.refreshStrategy = Objects.requireNonNull(refreshStrategy, "refreshStrategy is required");
    }

    /**
     * Cache key: mode plus every waypoint as "lng,lat" rounded to 4 decimals (about 11 m),
     * so nearby repeats of the same route share one entry.
     */
    public static String routeKey(TravelMode mode, List<Waypoint> waypoints) {
        String coords = waypoints.stream()
            .map(w -> String.format(Locale.ROOT, "%.4f,%.4f", w.lng(), w.lat()))
            .collect(Collectors.joining("|"));
        return "directions:" + mode.profile() + ":" + coords;
    }

    /**
     * @return the route, or empty when fewer than two waypoints are given, no route
     *     exists, or the remote lookup failed
     */
    public Optional<DirectionsRoute> route(TravelMode mode, List<Waypoint> waypoints) {
        if (waypoints.size() < 2) {
            log.warn("Directions need at least 2 waypoints, got {}", waypoints.size());
            return Optional.empty();
        }
        List<Waypoint> effective = waypoints;
        if (effective.size() > MAX_WAYPOINTS) {
            log.warn("Truncating {} waypoints to {}", effective.size(), MAX_WAYPOINTS);
            effective = List.copyOf(effective.subList(0, MAX_WAYPOINTS));
        }

        List<Waypoint> request = effective;
        try {
            return refreshStrategy.get(routeKey(mode, request), () -> client.fetchRoute(mode, request), cache);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Directions lookup failed ({} waypoints, {}): {}", request.size(), mode.profile(), e.getMessage());
            return Optional.empty();
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }
}
