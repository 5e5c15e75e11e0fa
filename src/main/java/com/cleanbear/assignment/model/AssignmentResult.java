package com.cleanbear.assignment.model;

import java.util.List;

/**
 * Output of one engine run. Every structurally valid input job appears in
 * exactly one of the three job buckets.
 */
public final class AssignmentResult {

    private final List<Assignment> assigned;
    private final List<JobOutcome> failed;
    private final List<JobOutcome> deferred;
    private final List<SkippedTechnician> skippedTechnicians;

    public AssignmentResult(List<Assignment> assigned, List<JobOutcome> failed,
                            List<JobOutcome> deferred, List<SkippedTechnician> skippedTechnicians) {
        this.assigned = List.copyOf(assigned);
        this.failed = List.copyOf(failed);
        this.deferred = List.copyOf(deferred);
        this.skippedTechnicians = List.copyOf(skippedTechnicians);
    }

    public List<Assignment> getAssigned() { return assigned; }
    public List<JobOutcome> getFailed() { return failed; }
    public List<JobOutcome> getDeferred() { return deferred; }
    public List<SkippedTechnician> getSkippedTechnicians() { return skippedTechnicians; }

    public int getTotalJobs() {
        return assigned.size() + failed.size() + deferred.size();
    }
}
