package com.cleanbear.assignment.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Commitments and last known position a caller carries over from an earlier run.
 */
public final class TechnicianStateSeed {

    private final String technicianId;
    private final Coordinate lastLocation;
    private final List<Commitment> commitments;

    public TechnicianStateSeed(String technicianId, Coordinate lastLocation, List<Commitment> commitments) {
        this.technicianId = technicianId;
        this.lastLocation = lastLocation;
        this.commitments = commitments == null ? List.of() : List.copyOf(commitments);
    }

    public String getTechnicianId() { return technicianId; }
    public Coordinate getLastLocation() { return lastLocation; }
    public List<Commitment> getCommitments() { return commitments; }

    public static final class Commitment {
        private final LocalDate date;
        private final TimeInterval interval;

        public Commitment(LocalDate date, TimeInterval interval) {
            this.date = date;
            this.interval = interval;
        }

        public LocalDate getDate() { return date; }
        public TimeInterval getInterval() { return interval; }
    }
}
