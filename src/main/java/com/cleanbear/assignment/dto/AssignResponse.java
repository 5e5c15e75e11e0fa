package com.cleanbear.assignment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssignResponse {

    private boolean success;
    private String error;
    private List<AssignedJobView> assignedJobs;
    private List<RejectedJobView> failedJobs;
    private List<RejectedJobView> deferredJobs;
    private List<SkippedTechnicianView> skippedTechnicians;
    private AssignmentSummary summary;
    private String humanMessage;

    public AssignResponse() {}

    public AssignResponse(List<AssignedJobView> assignedJobs, List<RejectedJobView> failedJobs,
                          List<RejectedJobView> deferredJobs, List<SkippedTechnicianView> skippedTechnicians,
                          AssignmentSummary summary, String humanMessage) {
        this.success = true;
        this.assignedJobs = assignedJobs;
        this.failedJobs = failedJobs;
        this.deferredJobs = deferredJobs;
        this.skippedTechnicians = skippedTechnicians;
        this.summary = summary;
        this.humanMessage = humanMessage;
    }

    /**
     * Whole-request failure: nothing was attempted, every job counts as unassigned.
     */
    public static AssignResponse failure(String error, String humanMessage, int totalJobs) {
        AssignResponse response = new AssignResponse(List.of(), List.of(), List.of(), List.of(),
                new AssignmentSummary(totalJobs, 0, 0, 0), humanMessage);
        response.success = false;
        response.error = error;
        return response;
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public List<AssignedJobView> getAssignedJobs() { return assignedJobs; }
    public List<RejectedJobView> getFailedJobs() { return failedJobs; }
    public List<RejectedJobView> getDeferredJobs() { return deferredJobs; }
    public List<SkippedTechnicianView> getSkippedTechnicians() { return skippedTechnicians; }
    public AssignmentSummary getSummary() { return summary; }
    public String getHumanMessage() { return humanMessage; }
}
