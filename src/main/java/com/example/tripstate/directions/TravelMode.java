package com.example.tripstate.directions;

import java.util.Locale;

public enum TravelMode {
    WALKING("walking"),
    CYCLING("cycling"),
    DRIVING("driving"),
    DRIVING_TRAFFIC("driving-traffic");

    private final String profile;

    TravelMode(String profile) {
        this.profile = profile;
    }

    /** Routing profile name as used in request keys and by the remote API. */
    public String profile() {
        return profile;
    }

    public static TravelMode fromProfile(String profile) {
        String wanted = profile.trim().toLowerCase(Locale.ROOT);
        for (TravelMode mode : values()) {
            if (mode.profile.equals(wanted)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown travel mode: " + profile);
    }
}
