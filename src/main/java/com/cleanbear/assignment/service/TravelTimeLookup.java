package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.TechnicianState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Looks up travel times for all candidates of one job in parallel. All lookups
 * share one deadline; a lookup still running at the deadline is cancelled (its
 * worker thread interrupted) and counts as unreachable, as does a failed one.
 * Returns only after every lookup has settled.
 */
public class TravelTimeLookup {

    private static final Logger logger = LoggerFactory.getLogger(TravelTimeLookup.class);

    private final DistanceProvider distanceProvider;
    private final Executor executor;
    private final long timeoutMs;

    public TravelTimeLookup(DistanceProvider distanceProvider, Executor executor, long timeoutMs) {
        this.distanceProvider = distanceProvider;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Travel minutes from each candidate's current location to {@code destination},
     * keyed by technician id in candidate order.
     */
    public Map<String, Double> lookup(List<TechnicianState> candidates, Coordinate destination) {
        List<FutureTask<Double>> tasks = new ArrayList<>(candidates.size());

        for (TechnicianState candidate : candidates) {
            Coordinate origin = candidate.getCurrentLocation();
            FutureTask<Double> task = new FutureTask<>(() -> distanceProvider.travelMinutes(origin, destination));
            tasks.add(task);
            executor.execute(task);
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Map<String, Double> minutes = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            String technicianId = candidates.get(i).getTechnicianId();
            minutes.put(technicianId, await(tasks.get(i), technicianId, deadline));
        }
        return minutes;
    }

    private double await(FutureTask<Double> task, String technicianId, long deadline) {
        try {
            return task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            logger.warn("Travel lookup for technician {} timed out after {} ms", technicianId, timeoutMs);
        } catch (ExecutionException e) {
            logger.warn("Travel lookup for technician {} failed: {}", technicianId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for travel lookup of technician {}", technicianId);
        }
        return DistanceProvider.UNREACHABLE_MINUTES;
    }
}
