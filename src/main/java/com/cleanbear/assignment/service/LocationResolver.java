package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;
import com.cleanbear.assignment.model.LocationInput;
import com.cleanbear.assignment.repository.KakaoGeocodingClient;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns a caller-supplied location into a coordinate before it reaches the engine.
 */
@Service
public class LocationResolver {

    private static final Logger logger = LoggerFactory.getLogger(LocationResolver.class);

    private final KakaoGeocodingClient geocodingClient;
    private final Cache<String, Coordinate> resolved = Caffeine.newBuilder()
            .maximumSize(5_000)
            .expireAfterWrite(Duration.ofHours(12))
            .build();

    public LocationResolver(KakaoGeocodingClient geocodingClient) {
        this.geocodingClient = geocodingClient;
    }

    /**
     * Empty when the input has no location or its address cannot be geocoded.
     */
    public Optional<Coordinate> resolve(LocationInput input) {
        switch (input.getKind()) {
            case COORDINATE:
                return Optional.of(input.getCoordinate());
            case ADDRESS:
                return geocode(input.getAddress());
            default:
                return Optional.empty();
        }
    }

    private Optional<Coordinate> geocode(String address) {
        Coordinate cached = resolved.getIfPresent(address);
        if (cached != null) {
            return Optional.of(cached);
        }

        if (!geocodingClient.isConfigured()) {
            logger.warn("Cannot geocode '{}': kakao.api-key is not configured", address);
            return Optional.empty();
        }

        try {
            Optional<Coordinate> coordinate = geocodingClient.geocode(address);
            coordinate.ifPresent(c -> resolved.put(address, c));
            return coordinate;
        } catch (RuntimeException e) {
            logger.warn("Geocoding '{}' failed: {}", address, e.getMessage());
            return Optional.empty();
        }
    }
}
