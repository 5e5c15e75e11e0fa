package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.Coordinate;

/**
 * Travel time between two points. Implementations never throw: when the time
 * cannot be determined they return {@link #UNREACHABLE_MINUTES}, so the
 * candidate is ranked last instead of being dropped.
 */
public interface DistanceProvider {

    double UNREACHABLE_MINUTES = 9999.0;

    double travelMinutes(Coordinate origin, Coordinate destination);

    static boolean isUnreachable(double minutes) {
        return minutes >= UNREACHABLE_MINUTES;
    }
}
