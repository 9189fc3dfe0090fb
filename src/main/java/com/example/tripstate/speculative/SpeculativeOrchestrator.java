package com.example.tripstate.speculative;

import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.feasibility.FeasibilityReport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts itinerary generation ahead of the user's request when feasibility looks good,
 * and lets the request path pick up whatever the speculative run produced.
 */
public class SpeculativeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SpeculativeOrchestrator.class);

    private final SpeculativeJobTracker tracker;
    private final DayPlanGenerator generator;
    private final Executor executor;
    private final BoundedCache<Long, List<String>> speculativeDays;
    private final Duration awaitTimeout;

    // at most one current run per trip; every write a run makes is checked against this map
    private final ConcurrentHashMap<Long, Run> running = new ConcurrentHashMap<>();

    public SpeculativeOrchestrator(
        SpeculativeJobTracker tracker,
        DayPlanGenerator generator,
        Executor executor,
        BoundedCache<Long, List<String>> speculativeDays,
        Duration awaitTimeout
    ) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.speculativeDays = Objects.requireNonNull(speculativeDays, "speculativeDays is required");
        this.awaitTimeout = Objects.requireNonNull(awaitTimeout, "awaitTimeout is required");
    }

    /**
     * Feeds a fresh feasibility result. Starts background generation of the first
     * {@code maxSpeculativeDays} days when the trigger fires and nothing runs yet.
     *
     * @return true if a speculative run was started
     */
    public boolean onFeasibility(long tripId, FeasibilityReport report) {
        if (!tracker.shouldTrigger(report.verdict(), report.score())) {
            return false;
        }

        Run run = new Run(tripId);
        Run claimed = running.compute(tripId, (id, current) -> {
            if (tracker.hasJob(id)) {
                return current;
            }
            tracker.start(id);
            speculativeDays.delete(id);
            return run;
        });
        if (claimed != run) {
            log.debug("Speculative run already in flight for trip {}", tripId);
            return false;
        }

        run.future = CompletableFuture.runAsync(() -> generate(run), executor);
        run.future.whenComplete((ignored, error) -> running.remove(tripId, run));
        return true;
    }

    /**
     * Builds a full itinerary. Waits a bounded time for an in-flight speculative run,
     * reuses its days when it completed, and generates the rest on the calling thread.
     */
    public ItineraryPlan planTrip(long tripId, int totalDays) {
        if (tracker.hasJob(tripId)) {
            awaitSpeculation(tripId);
        }

        List<String> reusable = tracker.getJob(tripId)
            .filter(job -> job.status() == JobStatus.COMPLETE)
            .flatMap(job -> speculativeDays.get(tripId))
            .orElse(List.of());

        int reused = Math.min(reusable.size(), Math.max(0, totalDays));
        List<String> days = new ArrayList<>(reusable.subList(0, reused));
        for (int day = reused + 1; day <= totalDays; day++) {
            days.add(generator.generateDay(tripId, day));
        }
        log.info("Planned trip {}: {} days, {} reused from speculation", tripId, days.size(), reused);
        return new ItineraryPlan(tripId, List.copyOf(days), reused);
    }

    /** Stops speculation for a trip, e.g. when the user navigates away. */
    public void abort(long tripId) {
        Run run = running.remove(tripId);
        tracker.abort(tripId);
        if (run != null) {
            run.cancel();
        }
    }

    /**
     * Aborts every run and drops all speculative state: tracked jobs and generated days.
     */
    public void clear() {
        for (Long tripId : running.keySet()) {
            abort(tripId);
        }
        tracker.clear();
        speculativeDays.clear();
    }

    private void generate(Run run) {
        long tripId = run.tripId;
        List<String> days = new ArrayList<>();
        try {
            for (int day = 1; day <= tracker.maxSpeculativeDays(); day++) {
                if (!isCurrent(run)) {
                    log.debug("Speculative run for trip {} stopped after {} days", tripId, days.size());
                    return;
                }
                days.add(generator.generateDay(tripId, day));
                if (!commit(run, List.copyOf(days), day)) {
                    log.debug("Dropping day {} of superseded run for trip {}", day, tripId);
                    return;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Speculative run for trip {} failed: {}", tripId, e.getMessage());
            running.computeIfPresent(tripId, (id, current) -> {
                if (current == run) {
                    tracker.abort(id);
                }
                return current;
            });
        }
    }

    private boolean isCurrent(Run run) {
        return running.get(run.tripId) == run && tracker.hasJob(run.tripId);
    }

    // holds the trip's slot while writing, so abort or restart cannot interleave
    private boolean commit(Run run, List<String> days, int daysGenerated) {
        boolean[] written = {false};
        running.computeIfPresent(run.tripId, (id, current) -> {
            if (current == run && tracker.hasJob(id)) {
                speculativeDays.set(id, days);
                tracker.update(id, daysGenerated);
                written[0] = true;
            }
            return current;
        });
        return written[0];
    }

    private void awaitSpeculation(long tripId) {
        Run current = running.get(tripId);
        CompletableFuture<Void> run = current == null ? null : current.future;
        if (run == null) {
            return;
        }
        try {
            run.get(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Speculative run for trip {} still busy after {}, generating fresh", tripId, awaitTimeout);
        } catch (ExecutionException e) {
            log.warn("Speculative run for trip {} failed: {}", tripId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.debug("Speculative run for trip {} was canceled", tripId);
        }
    }

    private static final class Run {
        final long tripId;
        volatile CompletableFuture<Void> future;

        Run(long tripId) {
            this.tripId = tripId;
        }

        void cancel() {
            CompletableFuture<Void> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
