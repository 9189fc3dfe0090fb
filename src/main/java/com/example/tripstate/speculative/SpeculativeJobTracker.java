package com.example.tripstate.speculative;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks speculative itinerary generation per trip.
 *
 * <p>A job is RUNNING after {@link #start(long)} and moves to COMPLETE once
 * {@code maxSpeculativeDays} days are reported, or to ABORTED through
 * {@link #abort(long)}. Terminal jobs stay queryable until {@link #sweep()} drops
 * them by age, or until {@link #clear()} drops everything on an administrative reset.
 *
 * <p>Unknown trip ids are a normal state for callers: queries return neutral
 * results and transitions are no-ops. Each per-trip check-then-transition runs
 * atomically; updates for one trip are expected from a single producer and the last
 * write wins.
 */
public class SpeculativeJobTracker {

    private static final Logger log = LoggerFactory.getLogger(SpeculativeJobTracker.class);

    public static final int DEFAULT_SCORE_THRESHOLD = 80;
    public static final int DEFAULT_MAX_SPECULATIVE_DAYS = 3;
    public static final Duration DEFAULT_RETENTION_TTL = Duration.ofMinutes(10);

    private final ConcurrentHashMap<Long, SpeculativeJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int scoreThreshold;
    private final int maxSpeculativeDays;
    private final long retentionTtlMillis;

    public SpeculativeJobTracker(Clock clock) {
        this(clock, DEFAULT_SCORE_THRESHOLD, DEFAULT_MAX_SPECULATIVE_DAYS, DEFAULT_RETENTION_TTL);
    }

    public SpeculativeJobTracker(Clock clock, int scoreThreshold, int maxSpeculativeDays, Duration retentionTtl) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.scoreThreshold = scoreThreshold;
        this.maxSpeculativeDays = maxSpeculativeDays;
        this.retentionTtlMillis = Objects.requireNonNull(retentionTtl, "retentionTtl is required").toMillis();
    }

    /**
     * @param verdict overall feasibility verdict, only {@code "yes"} qualifies
     * @param score   feasibility score 0-100
     */
    public boolean shouldTrigger(String verdict, int score) {
        return "yes".equals(verdict) && score >= scoreThreshold;
    }

    /**
     * Registers a RUNNING job with no progress. Replaces any existing job for the trip,
     * including a running one.
     */
    public void start(long tripId) {
        SpeculativeJob previous = jobs.put(tripId, SpeculativeJob.started(tripId, clock.millis()));
        if (previous != null && previous.status() == JobStatus.RUNNING) {
            log.info("Restarted speculative job for trip {} (dropped {} days)", tripId, previous.daysGenerated());
        } else {
            log.info("Started speculative job for trip {}", tripId);
        }
    }

    public void update(long tripId, int daysGenerated) {
        jobs.computeIfPresent(tripId, (id, job) -> {
            if (job.status().isTerminal()) {
                return job;
            }
            SpeculativeJob next = job.withProgress(daysGenerated, maxSpeculativeDays);
            if (next.status() == JobStatus.COMPLETE) {
                log.info("Speculative job complete for trip {} ({} days)", id, daysGenerated);
            }
            return next;
        });
    }

    /** True only while the trip's job is RUNNING. */
    public boolean hasJob(long tripId) {
        SpeculativeJob job = jobs.get(tripId);
        return job != null && job.status() == JobStatus.RUNNING;
    }

    public Optional<SpeculativeJob> getJob(long tripId) {
        return Optional.ofNullable(jobs.get(tripId));
    }

    public void abort(long tripId) {
        jobs.computeIfPresent(tripId, (id, job) -> {
            if (job.status() != JobStatus.RUNNING) {
                return job;
            }
            log.info("Aborted speculative job for trip {}", id);
            return job.aborted();
        });
    }

    /**
     * Drops every job older than the retention TTL, whatever its status.
     *
     * @return number of jobs removed
     */
    public int sweep() {
        long now = clock.millis();
        int removed = 0;
        for (SpeculativeJob job : jobs.values()) {
            // conditional remove keeps a job restarted during the sweep
            if (now - job.startedAt() > retentionTtlMillis && jobs.remove(job.tripId(), job)) {
                removed++;
            }
        }
        return removed;
    }

    /** Forgets every job, whatever its status. */
    public void clear() {
        jobs.clear();
        log.info("Cleared speculative jobs");
    }

    public SpeculativeStats stats() {
        int active = 0;
        int completed = 0;
        long days = 0;
        for (SpeculativeJob job : jobs.values()) {
            if (job.status() == JobStatus.RUNNING) {
                active++;
            } else if (job.status() == JobStatus.COMPLETE) {
                completed++;
            }
            days += job.daysGenerated();
        }
        return new SpeculativeStats(active, completed, days);
    }

    public int maxSpeculativeDays() {
        return maxSpeculativeDays;
    }

    public int scoreThreshold() {
        return scoreThreshold;
    }
}
