package com.example.tripstate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.tripstate.feasibility.FeasibilityReport;
import com.example.tripstate.speculative.JobStatus;
import com.example.tripstate.speculative.SpeculativeJobTracker;
import com.example.tripstate.speculative.SpeculativeOrchestrator;
import com.example.tripstate.speculative.SpeculativeSweepScheduler;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"backend.latency-ms=0", "speculative.max-days=2"})
class TripStateApplicationTests {

    @Autowired
    private SpeculativeJobTracker tracker;

    @Autowired
    private SpeculativeOrchestrator orchestrator;

    @Autowired
    private SpeculativeSweepScheduler sweepScheduler;

    @Test
    void wiresConfiguredTracker() {
        assertEquals(80, tracker.scoreThreshold());
        assertEquals(2, tracker.maxSpeculativeDays());
    }

    @Test
    void speculationRunsOnBackgroundExecutor() throws InterruptedException {
        assertTrue(orchestrator.onFeasibility(501, new FeasibilityReport("yes", 88)));

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (tracker.hasJob(501) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(JobStatus.COMPLETE, tracker.getJob(501).orElseThrow().status());
        assertEquals(2, orchestrator.planTrip(501, 3).speculativeDaysReused());
        sweepScheduler.sweep();
        assertTrue(tracker.getJob(501).isPresent());
    }
}
