package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.model.TechnicianState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TravelTimeLookupTest {

    private static final Coordinate SITE = new Coordinate(37.5, 127.0);

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final CountDownLatch never = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        never.countDown();
        executor.shutdownNow();
    }

    private static TechnicianState state(String id, double lat) {
        return TechnicianState.fresh(Technician.builder().technicianId(id).home(new Coordinate(lat, 127.0))
                .serviceTypes(Set.of("입주청소")).overtimeAllowed(true).build());
    }

    @Test
    void testResultsKeyedInCandidateOrder() {
        TravelTimeLookup lookup = new TravelTimeLookup(new StraightLineDistanceProvider(30.0), executor, 1_000);

        Map<String, Double> minutes = lookup.lookup(List.of(state("B", 37.6), state("A", 37.5)), SITE);

        assertEquals(List.of("B", "A"), List.copyOf(minutes.keySet()));
        assertEquals(0.0, minutes.get("A"));
        assertTrue(minutes.get("B") > 20.0);
    }

    @Test
    void testHungLookupTimesOutToSentinel() {
        DistanceProvider hangsForB = (origin, destination) -> {
            if (origin.getLat() > 37.55) {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return 7.0;
        };
        TravelTimeLookup lookup = new TravelTimeLookup(hangsForB, executor, 100);

        Map<String, Double> minutes = lookup.lookup(List.of(state("A", 37.5), state("B", 37.6)), SITE);

        assertEquals(7.0, minutes.get("A"));
        assertEquals(DistanceProvider.UNREACHABLE_MINUTES, minutes.get("B"));
    }

    @Test
    void testTimedOutLookupReleasesItsWorker() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        DistanceProvider hangs = (origin, destination) -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return 7.0;
        };
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            TravelTimeLookup lookup = new TravelTimeLookup(hangs, single, 100);

            assertEquals(DistanceProvider.UNREACHABLE_MINUTES, lookup.lookup(List.of(state("A", 37.6)), SITE).get("A"));
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));

            // The only pool thread is free again for the next job.
            TravelTimeLookup next = new TravelTimeLookup(new StraightLineDistanceProvider(30.0), single, 1_000);
            assertEquals(0.0, next.lookup(List.of(state("B", 37.5)), SITE).get("B"));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void testThrowingProviderBecomesSentinel() {
        DistanceProvider broken = (origin, destination) -> {
            throw new IllegalStateException("boom");
        };
        TravelTimeLookup lookup = new TravelTimeLookup(broken, executor, 1_000);

        Map<String, Double> minutes = lookup.lookup(List.of(state("A", 37.5)), SITE);

        assertEquals(DistanceProvider.UNREACHABLE_MINUTES, minutes.get("A"));
    }
}
