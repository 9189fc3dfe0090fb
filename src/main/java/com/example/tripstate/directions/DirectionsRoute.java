package com.example.tripstate.directions;

import java.util.List;

/**
 * @param mode            profile the route was computed for
 * @param distanceMeters  total length
 * @param durationSeconds total travel time
 * @param geometry        route line through the waypoints
 */
public record DirectionsRoute(TravelMode mode, double distanceMeters, double durationSeconds, List<Waypoint> geometry) {}
