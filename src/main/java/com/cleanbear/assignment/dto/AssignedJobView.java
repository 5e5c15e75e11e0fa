package com.cleanbear.assignment.dto;

import com.cleanbear.assignment.model.Assignment;
import com.cleanbear.assignment.model.TimeStatus;
import com.cleanbear.assignment.util.TimeFormats;

public class AssignedJobView {

    public static final String TO_BE_CONFIRMED_MEMO = "시간 미정 - 전날 통화 조율";

    private String jobId;
    private String technicianId;
    private String technicianName;
    private String date;
    private String serviceType;
    private Integer durationMin;
    private String startTime;
    private String endTime;
    private String timeStatus;
    private double travelTimeMinutes;
    private String status;
    private String memo;

    public AssignedJobView() {}

    public static AssignedJobView from(Assignment assignment) {
        AssignedJobView view = new AssignedJobView();
        view.jobId = assignment.getJobId();
        view.technicianId = assignment.getTechnicianId();
        view.technicianName = assignment.getTechnician().getName();
        view.date = assignment.getJob().getDate().toString();
        view.serviceType = assignment.getJob().getServiceType();
        view.durationMin = assignment.getJob().getDurationMin();
        view.startTime = TimeFormats.format(assignment.getInterval().getStart());
        view.endTime = TimeFormats.format(assignment.getInterval().getEnd());
        view.timeStatus = assignment.getTimeStatus().getWireName();
        view.travelTimeMinutes = assignment.getTravelMinutes();
        view.status = "assigned";
        view.memo = assignment.getTimeStatus() == TimeStatus.TO_BE_CONFIRMED ? TO_BE_CONFIRMED_MEMO : null;
        return view;
    }

    public String getJobId() { return jobId; }
    public String getTechnicianId() { return technicianId; }
    public String getTechnicianName() { return technicianName; }
    public String getDate() { return date; }
    public String getServiceType() { return serviceType; }
    public Integer getDurationMin() { return durationMin; }
    public String getStartTime() { return startTime; }
    public String getEndTime() { return endTime; }
    public String getTimeStatus() { return timeStatus; }
    public double getTravelTimeMinutes() { return travelTimeMinutes; }
    public String getStatus() { return status; }
    public String getMemo() { return memo; }
}
