package com.example.tripstate.speculative;

/**
 * Immutable snapshot of one trip's speculative generation.
 *
 * @param tripId        trip the generation belongs to
 * @param startedAt     epoch millis of the last {@code start}, drives retention
 * @param status        lifecycle state
 * @param daysGenerated days produced so far
 */
public record SpeculativeJob(long tripId, long startedAt, JobStatus status, int daysGenerated) {

    static SpeculativeJob started(long tripId, long now) {
        return new SpeculativeJob(tripId, now, JobStatus.RUNNING, 0);
    }

    SpeculativeJob withProgress(int days, int maxSpeculativeDays) {
        JobStatus next = days >= maxSpeculativeDays ? JobStatus.COMPLETE : JobStatus.RUNNING;
        return new SpeculativeJob(tripId, startedAt, next, days);
    }

    SpeculativeJob aborted() {
        return new SpeculativeJob(tripId, startedAt, JobStatus.ABORTED, daysGenerated);
    }
}
