package com.cleanbear.assignment.model;

/**
 * Answer of the single-job selector: the best technician, or why there is none.
 */
public final class SelectionResult {

    private final Assignment assignment;
    private final ReasonCode reason;
    private final String detail;

    private SelectionResult(Assignment assignment, ReasonCode reason, String detail) {
        this.assignment = assignment;
        this.reason = reason;
        this.detail = detail;
    }

    public static SelectionResult selected(Assignment assignment) {
        return new SelectionResult(assignment, null, null);
    }

    public static SelectionResult none(ReasonCode reason, String detail) {
        return new SelectionResult(null, reason, detail);
    }

    public boolean isSelected() {
        return assignment != null;
    }

    public Assignment getAssignment() { return assignment; }
    public ReasonCode getReason() { return reason; }
    public String getDetail() { return detail; }
}
