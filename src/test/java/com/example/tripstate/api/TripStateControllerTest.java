package com.example.tripstate.api;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.tripstate.backend.MockBackend;
import com.example.tripstate.core.BoundedCache;
import com.example.tripstate.directions.DirectionsService;
import com.example.tripstate.feasibility.FeasibilityCache;
import com.example.tripstate.imagery.ImageryService;
import com.example.tripstate.refresh.NaiveRefreshStrategy;
import com.example.tripstate.refresh.SupersedingFetcher;
import com.example.tripstate.speculative.SpeculativeJobTracker;
import com.example.tripstate.speculative.SpeculativeOrchestrator;
import com.example.tripstate.support.MutableClock;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TripStateControllerTest {

    private static final String PARIS_WALK = "48.8606,2.3376;48.8530,2.3499";

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-06-01T08:00:00Z");
        Executor direct = Runnable::run;
        MockBackend backend = new MockBackend(0);
        SpeculativeJobTracker tracker = new SpeculativeJobTracker(clock);
        SpeculativeOrchestrator orchestrator = new SpeculativeOrchestrator(
            tracker, backend, direct, new BoundedCache<>(10, Duration.ofMinutes(10), clock), Duration.ofSeconds(1));
        DirectionsService directions = new DirectionsService(
            backend, new BoundedCache<>(10, Duration.ofHours(1), clock), new NaiveRefreshStrategy<>());
        BoundedCache<String, String> imageCache = new BoundedCache<>(10, Duration.ofHours(1), clock);
        ImageryService imagery = new ImageryService(
            backend, imageCache, new NaiveRefreshStrategy<>(), new SupersedingFetcher<>(imageCache, direct));
        FeasibilityCache feasibility = new FeasibilityCache(new BoundedCache<>(10, Duration.ofHours(24), clock));

        mockMvc = MockMvcBuilders.standaloneSetup(
                new TripStateController(directions, imagery, feasibility, tracker, orchestrator, backend))
            .build();
    }

    @Test
    void directionsReturnsRouteAndCachesIt() throws Exception {
        mockMvc.perform(get("/directions").param("mode", "walking").param("waypoints", PARIS_WALK))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("WALKING"))
            .andExpect(jsonPath("$.geometry", hasSize(2)));
        mockMvc.perform(get("/directions").param("waypoints", PARIS_WALK))
            .andExpect(status().isOk());

        mockMvc.perform(get("/stats"))
            .andExpect(jsonPath("$.directionsCacheSize").value(1))
            .andExpect(jsonPath("$.backendRequests").value(1));
    }

    @Test
    void directionsWithOneWaypointIsNotFound() throws Exception {
        mockMvc.perform(get("/directions").param("waypoints", "48.8606,2.3376"))
            .andExpect(status().isNotFound());
    }

    @Test
    void badInputIsRejected() throws Exception {
        mockMvc.perform(get("/directions").param("mode", "teleport").param("waypoints", PARIS_WALK))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown travel mode: teleport"));
        mockMvc.perform(get("/directions").param("waypoints", "48.8606"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void imageryServesRemoteUrl() throws Exception {
        mockMvc.perform(get("/imagery").param("destination", "Paris, France"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.destination").value("Paris, France"))
            .andExpect(jsonPath("$.url", startsWith("https://images.example.com/paris.jpg")));
    }

    @Test
    void strongFeasibilityFeedsSpeculativePlan() throws Exception {
        mockMvc.perform(post("/feasibility/7")
                .param("passport", "India")
                .param("destination", "Tokyo, Japan")
                .param("verdict", "yes")
                .param("score", "90"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.speculationStarted").value(true));

        mockMvc.perform(get("/speculative/7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETE"))
            .andExpect(jsonPath("$.daysGenerated").value(3));

        mockMvc.perform(get("/trips/7/plan").param("days", "4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.days", hasSize(4)))
            .andExpect(jsonPath("$.days[0]").value("Trip 7 - day 1"))
            .andExpect(jsonPath("$.speculativeDaysReused").value(3));

        mockMvc.perform(get("/stats"))
            .andExpect(jsonPath("$.speculative.completedJobs").value(1))
            .andExpect(jsonPath("$.feasibility.size").value(1));
    }

    @Test
    void weakFeasibilityDoesNotSpeculate() throws Exception {
        mockMvc.perform(post("/feasibility/8")
                .param("passport", "India")
                .param("destination", "Peru")
                .param("verdict", "maybe")
                .param("score", "85"))
            .andExpect(jsonPath("$.speculationStarted").value(false));

        mockMvc.perform(get("/speculative/8"))
            .andExpect(status().isNotFound());
    }

    @Test
    void abortAnswersNoContent() throws Exception {
        mockMvc.perform(post("/speculative/9/abort"))
            .andExpect(status().isNoContent());
    }

    @Test
    void resetDropsSpeculativeState() throws Exception {
        mockMvc.perform(post("/feasibility/12")
                .param("passport", "Canada")
                .param("destination", "Lisbon, Portugal")
                .param("verdict", "yes")
                .param("score", "97"))
            .andExpect(jsonPath("$.speculationStarted").value(true));

        mockMvc.perform(get("/reset")).andExpect(status().isOk());

        mockMvc.perform(get("/speculative/12"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/trips/12/plan").param("days", "3"))
            .andExpect(jsonPath("$.speculativeDaysReused").value(0));
    }

    @Test
    void resetClearsCachesAndCounters() throws Exception {
        mockMvc.perform(get("/imagery").param("destination", "Oslo"));

        mockMvc.perform(get("/reset")).andExpect(status().isOk());

        mockMvc.perform(get("/stats"))
            .andExpect(jsonPath("$.imageryCacheSize").value(0))
            .andExpect(jsonPath("$.backendRequests").value(0));
    }
}
