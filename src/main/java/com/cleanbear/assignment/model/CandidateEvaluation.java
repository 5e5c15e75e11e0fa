package com.cleanbear.assignment.model;

/**
 * Whether one technician can take one job, and when.
 */
public final class CandidateEvaluation {

    private final TimeInterval interval;
    private final TimeStatus timeStatus;
    private final ReasonCode rejection;

    private CandidateEvaluation(TimeInterval interval, TimeStatus timeStatus, ReasonCode rejection) {
        this.interval = interval;
        this.timeStatus = timeStatus;
        this.rejection = rejection;
    }

    public static CandidateEvaluation accepted(TimeInterval interval, TimeStatus timeStatus) {
        return new CandidateEvaluation(interval, timeStatus, null);
    }

    public static CandidateEvaluation rejected(TimeInterval interval, ReasonCode reason) {
        return new CandidateEvaluation(interval, null, reason);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public TimeInterval getInterval() { return interval; }
    public TimeStatus getTimeStatus() { return timeStatus; }
    public ReasonCode getRejection() { return rejection; }
}
