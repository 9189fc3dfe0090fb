package com.example.tripstate.speculative;

import java.util.List;

/**
 * @param tripId                trip the plan is for
 * @param days                  day plans in order, day 1 first
 * @param speculativeDaysReused leading days taken from a finished speculative run
 */
public record ItineraryPlan(long tripId, List<String> days, int speculativeDaysReused) {}
