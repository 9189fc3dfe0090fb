package com.example.tripstate.speculative;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link SpeculativeJobTracker#sweep()} on a fixed delay.
 */
@Component
public class SpeculativeSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SpeculativeSweepScheduler.class);

    private final SpeculativeJobTracker tracker;

    public SpeculativeSweepScheduler(SpeculativeJobTracker tracker) {
        this.tracker = tracker;
    }

    @Scheduled(
        fixedDelayString = "${speculative.sweep-interval-ms:300000}",
        initialDelayString = "${speculative.sweep-interval-ms:300000}"
    )
    public void sweep() {
        int removed = tracker.sweep();
        if (removed > 0) {
            log.debug("Swept {} speculative jobs", removed);
        }
    }
}
