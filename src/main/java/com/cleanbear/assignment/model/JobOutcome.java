package com.cleanbear.assignment.model;

/**
 * A job that was not assigned, with the reason.
 */
public final class JobOutcome {

    private final Job job;
    private final ReasonCode reason;
    private final String detail;

    public JobOutcome(Job job, ReasonCode reason, String detail) {
        this.job = job;
        this.reason = reason;
        this.detail = detail;
    }

    public Job getJob() { return job; }
    public ReasonCode getReason() { return reason; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return "JobOutcome{" + job.getJobId() + ", " + reason + ", " + detail + "}";
    }
}
