package com.cleanbear.assignment.dto;

public class AssignmentSummary {

    private int totalJobs;
    private int assigned;
    private int failed;
    private int deferred;

    public AssignmentSummary() {}

    public AssignmentSummary(int totalJobs, int assigned, int failed, int deferred) {
        this.totalJobs = totalJobs;
        this.assigned = assigned;
        this.failed = failed;
        this.deferred = deferred;
    }

    public int getTotalJobs() { return totalJobs; }
    public int getAssigned() { return assigned; }
    public int getFailed() { return failed; }
    public int getDeferred() { return deferred; }
}
