package com.example.tripstate.speculative;

/**
 * Monitoring view over every retained job, terminal ones included until swept.
 *
 * @param activeJobs         jobs still running
 * @param completedJobs      jobs that reached the speculative day limit
 * @param totalDaysGenerated days generated across all retained jobs
 */
public record SpeculativeStats(int activeJobs, int completedJobs, long totalDaysGenerated) {}
