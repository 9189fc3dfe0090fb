package com.example.tripstate.directions;

import java.util.List;

/**
 * Remote routing source. Returns {@code null} when no route exists.
 */
public interface DirectionsClient {
    DirectionsRoute fetchRoute(TravelMode mode, List<Waypoint> waypoints);
}
