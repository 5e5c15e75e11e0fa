package com.cleanbear.assignment.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public class AssignRequest {

    @NotNull
    private List<JobRequest> jobs;

    private List<TechnicianRecord> technicians;       // null means use the roster
    private List<TechnicianStateRequest> technicianStates;
    private SystemRulesRequest systemRules;

    public AssignRequest() {}

    public AssignRequest(List<JobRequest> jobs, List<TechnicianRecord> technicians,
                         List<TechnicianStateRequest> technicianStates, SystemRulesRequest systemRules) {
        this.jobs = jobs;
        this.technicians = technicians;
        this.technicianStates = technicianStates;
        this.systemRules = systemRules;
    }

    public List<JobRequest> getJobs() { return jobs; }
    public List<TechnicianRecord> getTechnicians() { return technicians; }
    public List<TechnicianStateRequest> getTechnicianStates() { return technicianStates; }
    public SystemRulesRequest getSystemRules() { return systemRules; }

    public void setJobs(List<JobRequest> jobs) { this.jobs = jobs; }
    public void setTechnicians(List<TechnicianRecord> technicians) { this.technicians = technicians; }
    public void setTechnicianStates(List<TechnicianStateRequest> technicianStates) { this.technicianStates = technicianStates; }
    public void setSystemRules(SystemRulesRequest systemRules) { this.systemRules = systemRules; }
}
