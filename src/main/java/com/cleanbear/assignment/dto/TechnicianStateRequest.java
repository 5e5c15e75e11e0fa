package com.cleanbear.assignment.dto;

import java.util.List;

/**
 * Where a technician currently is and what they are already booked for.
 */
public class TechnicianStateRequest {

    private String technicianId;
    private Double lastLat;
    private Double lastLng;
    private String lastAddress;
    private List<CommitmentRequest> commitments;

    public TechnicianStateRequest() {}

    public String getTechnicianId() { return technicianId; }
    public Double getLastLat() { return lastLat; }
    public Double getLastLng() { return lastLng; }
    public String getLastAddress() { return lastAddress; }
    public List<CommitmentRequest> getCommitments() { return commitments; }

    public void setTechnicianId(String technicianId) { this.technicianId = technicianId; }
    public void setLastLat(Double lastLat) { this.lastLat = lastLat; }
    public void setLastLng(Double lastLng) { this.lastLng = lastLng; }
    public void setLastAddress(String lastAddress) { this.lastAddress = lastAddress; }
    public void setCommitments(List<CommitmentRequest> commitments) { this.commitments = commitments; }

    public static class CommitmentRequest {
        private String date;
        private String startTime;
        private String endTime;

        public CommitmentRequest() {}

        public CommitmentRequest(String date, String startTime, String endTime) {
            this.date = date;
            this.startTime = startTime;
            this.endTime = endTime;
        }

        public String getDate() { return date; }
        public String getStartTime() { return startTime; }
        public String getEndTime() { return endTime; }

        public void setDate(String date) { this.date = date; }
        public void setStartTime(String startTime) { this.startTime = startTime; }
        public void setEndTime(String endTime) { this.endTime = endTime; }
    }
}
