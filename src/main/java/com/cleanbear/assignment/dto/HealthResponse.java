package com.cleanbear.assignment.dto;

public class HealthResponse {

    private String status;
    private boolean rosterLoaded;
    private int technicianCount;
    private String lastRefreshedAt;

    public HealthResponse() {}

    public HealthResponse(String status, boolean rosterLoaded, int technicianCount, String lastRefreshedAt) {
        this.status = status;
        this.rosterLoaded = rosterLoaded;
        this.technicianCount = technicianCount;
        this.lastRefreshedAt = lastRefreshedAt;
    }

    public String getStatus() { return status; }
    public boolean isRosterLoaded() { return rosterLoaded; }
    public int getTechnicianCount() { return technicianCount; }
    public String getLastRefreshedAt() { return lastRefreshedAt; }
}
