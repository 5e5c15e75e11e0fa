package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.repository.KakaoDirectionsClient;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Road travel time from the Kakao directions API, with bounded retries and a
 * short-lived cache. Exhausted retries yield {@link #UNREACHABLE_MINUTES}.
 */
public class KakaoDistanceProvider implements DistanceProvider {

    private static final Logger logger = LoggerFactory.getLogger(KakaoDistanceProvider.class);

    private final KakaoDirectionsClient client;
    private final int retryCount;
    private final long retryBackoffMs;
    private final Cache<List<Coordinate>, Double> cache;

    public KakaoDistanceProvider(KakaoDirectionsClient client, int retryCount, long retryBackoffMs,
                                 long cacheSize, Duration cacheTtl) {
        this.client = client;
        this.retryCount = Math.max(0, retryCount);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterWrite(cacheTtl)
                .build();
    }

    @Override
    public double travelMinutes(Coordinate origin, Coordinate destination) {
        if (origin == null || destination == null) {
            return UNREACHABLE_MINUTES;
        }
        if (origin.equals(destination)) {
            return 0.0;
        }

        List<Coordinate> key = List.of(origin, destination);
        Double cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        double minutes = fetchWithRetry(origin, destination);
        if (!DistanceProvider.isUnreachable(minutes)) {
            cache.put(key, minutes);
        }
        return minutes;
    }

    private double fetchWithRetry(Coordinate origin, Coordinate destination) {
        long backoff = retryBackoffMs;
        Exception lastError = null;

        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                long seconds = client.fetchDurationSeconds(origin, destination);
                return Math.round(seconds / 60.0 * 10.0) / 10.0;
            } catch (RuntimeException e) {
                lastError = e;
                logger.debug("Directions attempt {} for {} -> {} failed: {}",
                        attempt + 1, origin, destination, e.getMessage());
            }

            if (attempt < retryCount && backoff > 0) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying directions {} -> {}", origin, destination);
                    return UNREACHABLE_MINUTES;
                }
                backoff *= 2;
            }
        }

        logger.warn("Directions lookup {} -> {} failed after {} attempts, using sentinel: {}",
                origin, destination, retryCount + 1,
                lastError != null ? lastError.getMessage() : "unknown error");
        return UNREACHABLE_MINUTES;
    }
}
