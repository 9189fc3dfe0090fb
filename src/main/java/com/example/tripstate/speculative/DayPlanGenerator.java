package com.example.tripstate.speculative;

/**
 * Produces the plan for one itinerary day. Usually backed by a slow remote model.
 */
@FunctionalInterface
public interface DayPlanGenerator {
    String generateDay(long tripId, int dayNumber);
}
