package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;

/**
 * Estimates travel time from the great-circle distance and a fixed average speed.
 * Used when no directions API key is configured.
 */
public class StraightLineDistanceProvider implements DistanceProvider {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private final double averageSpeedKmh;

    public StraightLineDistanceProvider(double averageSpeedKmh) {
        if (averageSpeedKmh <= 0) {
            throw new IllegalArgumentException("Average speed must be positive, got " + averageSpeedKmh);
        }
        this.averageSpeedKmh = averageSpeedKmh;
    }

    @Override
    public double travelMinutes(Coordinate origin, Coordinate destination) {
        if (origin == null || destination == null) {
            return UNREACHABLE_MINUTES;
        }
        double minutes = distanceKm(origin, destination) / averageSpeedKmh * 60.0;
        return Math.round(minutes * 10.0) / 10.0;
    }

    public static double distanceKm(Coordinate a, Coordinate b) {
        double dLat = Math.toRadians(b.getLat() - a.getLat());
        double dLng = Math.toRadians(b.getLng() - a.getLng());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.getLat())) * Math.cos(Math.toRadians(b.getLat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(h));
    }
}
