package com.example.tripstate.backend;

import com.example.tripstate.directions.DirectionsClient;
import com.example.tripstate.directions.DirectionsRoute;
import com.example.tripstate.directions.TravelMode;
import com.example.tripstate.directions.Waypoint;
import com.example.tripstate.imagery.ImageryClient;
import com.example.tripstate.speculative.DayPlanGenerator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in for the slow remote services (routing, photo search, itinerary model).
 * Every call sleeps for the configured latency and is counted.
 */
public class MockBackend implements DirectionsClient, ImageryClient, DayPlanGenerator {

    private static final double EARTH_RADIUS_METERS = 6_371_000;

    private final AtomicLong requestCount = new AtomicLong();
    private volatile long latencyMillis;

    public MockBackend(long latencyMillis) {
        this.latencyMillis = latencyMillis;
    }

    @Override
    public DirectionsRoute fetchRoute(TravelMode mode, List<Waypoint> waypoints) {
        simulateLatency();
        double distance = 0;
        for (int i = 1; i < waypoints.size(); i++) {
            distance += haversineMeters(waypoints.get(i - 1), waypoints.get(i));
        }
        return new DirectionsRoute(mode, distance, distance / speedMetersPerSecond(mode), List.copyOf(waypoints));
    }

    @Override
    public String findImageUrl(String query) {
        simulateLatency();
        if (query == null || query.isBlank()) {
            return null;
        }
        String slug = query.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return "https://images.example.com/" + slug + ".jpg?w=1600&h=900&fit=crop&q=80";
    }

    @Override
    public String generateDay(long tripId, int dayNumber) {
        simulateLatency();
        return "Trip " + tripId + " - day " + dayNumber;
    }

    public void setLatencyMillis(long ms) {
        this.latencyMillis = ms;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }

    private void simulateLatency() {
        requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static double speedMetersPerSecond(TravelMode mode) {
        return switch (mode) {
            case WALKING -> 1.4;
            case CYCLING -> 4.5;
            case DRIVING -> 13.9;
            case DRIVING_TRAFFIC -> 8.3;
        };
    }

    private static double haversineMeters(Waypoint a, Waypoint b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLng = Math.toRadians(b.lng() - a.lng());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat()))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(h));
    }
}
