package com.cleanbear.assignment.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Running schedule of one technician during a single assignment run.
 * Not thread-safe; the engine mutates it from one thread only.
 */
public class TechnicianState {

    private final Technician technician;
    private Coordinate currentLocation;
    private final Map<LocalDate, List<TimeInterval>> commitments = new TreeMap<>();

    private TechnicianState(Technician technician, Coordinate currentLocation) {
        this.technician = technician;
        this.currentLocation = currentLocation;
    }

    public static TechnicianState fresh(Technician technician) {
        return new TechnicianState(technician, technician.getHome());
    }

    public static TechnicianState seeded(Technician technician, TechnicianStateSeed seed) {
        if (seed == null) {
            return fresh(technician);
        }
        Coordinate start = seed.getLastLocation() != null ? seed.getLastLocation() : technician.getHome();
        TechnicianState state = new TechnicianState(technician, start);
        for (TechnicianStateSeed.Commitment commitment : seed.getCommitments()) {
            state.addInterval(commitment.getDate(), commitment.getInterval());
        }
        return state;
    }

    public Technician getTechnician() { return technician; }
    public Coordinate getCurrentLocation() { return currentLocation; }

    public String getTechnicianId() {
        return technician.getTechnicianId();
    }

    public int getDistinctDayCount() {
        return commitments.size();
    }

    public boolean hasCommitmentsOn(LocalDate date) {
        return commitments.containsKey(date);
    }

    /**
     * True when taking a job on {@code date} would push this technician past the day limit.
     */
    public boolean isDayLimitBlocked(LocalDate date, int maxPreassignDays) {
        return !hasCommitmentsOn(date) && commitments.size() >= maxPreassignDays;
    }

    public List<TimeInterval> getCommitments(LocalDate date) {
        List<TimeInterval> day = commitments.get(date);
        return day == null ? List.of() : Collections.unmodifiableList(day);
    }

    public OptionalInt lastEndOn(LocalDate date) {
        return getCommitments(date).stream().mapToInt(TimeInterval::getEnd).max();
    }

    public void commit(LocalDate date, TimeInterval interval, Coordinate jobLocation) {
        addInterval(date, interval);
        this.currentLocation = jobLocation;
    }

    private void addInterval(LocalDate date, TimeInterval interval) {
        List<TimeInterval> day = commitments.computeIfAbsent(date, d -> new ArrayList<>());
        day.add(interval);
        Collections.sort(day);
    }
}
