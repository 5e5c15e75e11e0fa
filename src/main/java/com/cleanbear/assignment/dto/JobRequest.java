package com.cleanbear.assignment.dto;

/**
 * One cleaning job as submitted by the booking side. Fields stay loosely typed so
 * a single bad value fails only that job.
 */
public class JobRequest {

    private String jobId;
    private String serviceType;
    private Double lat;
    private Double lng;
    private String address;
    private String date;            // yyyy-MM-dd
    private String durationMin;
    private Boolean timeFixed;
    private String fixedStartTime;  // HH:mm
    private String slotType;

    public JobRequest() {}

    public String getJobId() { return jobId; }
    public String getServiceType() { return serviceType; }
    public Double getLat() { return lat; }
    public Double getLng() { return lng; }
    public String getAddress() { return address; }
    public String getDate() { return date; }
    public String getDurationMin() { return durationMin; }
    public Boolean getTimeFixed() { return timeFixed; }
    public String getFixedStartTime() { return fixedStartTime; }
    public String getSlotType() { return slotType; }

    public void setJobId(String jobId) { this.jobId = jobId; }
    public void setServiceType(String serviceType) { this.serviceType = serviceType; }
    public void setLat(Double lat) { this.lat = lat; }
    public void setLng(Double lng) { this.lng = lng; }
    public void setAddress(String address) { this.address = address; }
    public void setDate(String date) { this.date = date; }
    public void setDurationMin(String durationMin) { this.durationMin = durationMin; }
    public void setTimeFixed(Boolean timeFixed) { this.timeFixed = timeFixed; }
    public void setFixedStartTime(String fixedStartTime) { this.fixedStartTime = fixedStartTime; }
    public void setSlotType(String slotType) { this.slotType = slotType; }
}
