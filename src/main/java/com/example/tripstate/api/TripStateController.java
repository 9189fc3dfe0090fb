package com.example.tripstate.api;

import com.example.tripstate.backend.MockBackend;
import com.example.tripstate.directions.DirectionsRoute;
import com.example.tripstate.directions.DirectionsService;
import com.example.tripstate.directions.TravelMode;
import com.example.tripstate.directions.Waypoint;
import com.example.tripstate.feasibility.FeasibilityCache;
import com.example.tripstate.feasibility.FeasibilityReport;
import com.example.tripstate.imagery.ImageryService;
import com.example.tripstate.speculative.ItineraryPlan;
import com.example.tripstate.speculative.SpeculativeJob;
import com.example.tripstate.speculative.SpeculativeJobTracker;
import com.example.tripstate.speculative.SpeculativeOrchestrator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TripStateController {

    private final DirectionsService directionsService;
    private final ImageryService imageryService;
    private final FeasibilityCache feasibilityCache;
    private final SpeculativeJobTracker tracker;
    private final SpeculativeOrchestrator orchestrator;
    private final MockBackend backend;

    public TripStateController(
        DirectionsService directionsService,
        ImageryService imageryService,
        FeasibilityCache feasibilityCache,
        SpeculativeJobTracker tracker,
        SpeculativeOrchestrator orchestrator,
        MockBackend backend
    ) {
        this.directionsService = directionsService;
        this.imageryService = imageryService;
        this.feasibilityCache = feasibilityCache;
        this.tracker = tracker;
        this.orchestrator = orchestrator;
        this.backend = backend;
    }

    /** {@code waypoints} is "lat,lng;lat,lng;..." */
    @GetMapping("/directions")
    public ResponseEntity<DirectionsRoute> directions(
        @RequestParam(defaultValue = "walking") String mode,
        @RequestParam String waypoints
    ) {
        List<Waypoint> parsed = Waypoint.parseList(waypoints);
        return ResponseEntity.of(directionsService.route(TravelMode.fromProfile(mode), parsed));
    }

    @GetMapping("/imagery")
    public ResponseEntity<Map<String, String>> imagery(@RequestParam String destination) {
        return imageryService.imageFor(destination)
            .map(url -> ResponseEntity.ok(Map.of("destination", destination, "url", url)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Records a feasibility result for the trip's corridor and starts speculative
     * generation when it qualifies.
     */
    @PostMapping("/feasibility/{tripId}")
    public Map<String, Object> feasibility(
        @PathVariable long tripId,
        @RequestParam String passport,
        @RequestParam String destination,
        @RequestParam String verdict,
        @RequestParam int score
    ) {
        FeasibilityReport report = new FeasibilityReport(verdict, score);
        feasibilityCache.put(passport, destination, report);
        boolean started = orchestrator.onFeasibility(tripId, report);
        return Map.of("tripId", tripId, "speculationStarted", started);
    }

    @GetMapping("/trips/{tripId}/plan")
    public ItineraryPlan plan(@PathVariable long tripId, @RequestParam(defaultValue = "5") int days) {
        return orchestrator.planTrip(tripId, days);
    }

    @GetMapping("/speculative/{tripId}")
    public ResponseEntity<SpeculativeJob> speculativeJob(@PathVariable long tripId) {
        return ResponseEntity.of(tracker.getJob(tripId));
    }

    @PostMapping("/speculative/{tripId}/abort")
    public ResponseEntity<Void> abort(@PathVariable long tripId) {
        orchestrator.abort(tripId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("speculative", tracker.stats());
        stats.put("feasibility", feasibilityCache.stats());
        stats.put("directionsCacheSize", directionsService.cacheSize());
        stats.put("imageryCacheSize", imageryService.cacheSize());
        stats.put("backendRequests", backend.getRequestCount());
        return stats;
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
        directionsService.clearCache();
        imageryService.clearCache();
        feasibilityCache.clear();
        orchestrator.clear();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
