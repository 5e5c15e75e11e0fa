package com.cleanbear.assignment.service;

import com.cleanbear.assignment.model.CandidateEvaluation;
import com.cleanbear.assignment.model.ReasonCode;
import com.cleanbear.assignment.model.TechnicianState;

/**
 * Outcome of matching one job against the current technician states, before
 * anything is committed.
 */
final class JobDecision {

    private final TechnicianState chosen;
    private final CandidateEvaluation evaluation;
    private final double travelMinutes;
    private final ReasonCode reason;
    private final String detail;

    private JobDecision(TechnicianState chosen, CandidateEvaluation evaluation, double travelMinutes,
                        ReasonCode reason, String detail) {
        this.chosen = chosen;
        this.evaluation = evaluation;
        this.travelMinutes = travelMinutes;
        this.reason = reason;
        this.detail = detail;
    }

    static JobDecision chosen(TechnicianState state, CandidateEvaluation evaluation, double travelMinutes) {
        return new JobDecision(state, evaluation, travelMinutes, null, null);
    }

    static JobDecision rejected(ReasonCode reason, String detail) {
        return new JobDecision(null, null, 0.0, reason, detail);
    }

    boolean isChosen() {
        return chosen != null;
    }

    TechnicianState getChosen() { return chosen; }
    CandidateEvaluation getEvaluation() { return evaluation; }
    double getTravelMinutes() { return travelMinutes; }
    ReasonCode getReason() { return reason; }
    String getDetail() { return detail; }
}
