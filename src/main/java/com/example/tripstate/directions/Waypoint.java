package com.example.tripstate.directions;

import java.util.ArrayList;
import java.util.List;

public record Waypoint(double lat, double lng) {

    /**
     * Parses {@code "lat,lng;lat,lng;..."}.
     *
     * @throws IllegalArgumentException on a malformed pair
     */
    public static List<Waypoint> parseList(String raw) {
        List<Waypoint> result = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }
        for (String pair : raw.split(";")) {
            String[] parts = pair.split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Waypoint must be 'lat,lng': " + pair);
            }
            try {
                result.add(new Waypoint(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Waypoint must be numeric: " + pair, e);
            }
        }
        return result;
    }
}
