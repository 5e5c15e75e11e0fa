package com.cleanbear.assignment.dto;

import com.cleanbear.assignment.model.Assignment;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.util.TimeFormats;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SingleAssignResponse {

    private boolean success;
    private TechnicianSummary technician;
    private Double travelTimeMinutes;
    private String startTime;
    private String endTime;
    private String timeStatus;
    private String error;
    private String message;

    public SingleAssignResponse() {}

    public static SingleAssignResponse of(Assignment assignment) {
        SingleAssignResponse response = new SingleAssignResponse();
        response.success = true;
        response.technician = new TechnicianSummary(assignment.getTechnician());
        response.travelTimeMinutes = assignment.getTravelMinutes();
        response.startTime = TimeFormats.format(assignment.getInterval().getStart());
        response.endTime = TimeFormats.format(assignment.getInterval().getEnd());
        response.timeStatus = assignment.getTimeStatus().getWireName();
        return response;
    }

    public static SingleAssignResponse failure(String error, String message) {
        SingleAssignResponse response = new SingleAssignResponse();
        response.success = false;
        response.error = error;
        response.message = message;
        return response;
    }

    public boolean isSuccess() { return success; }
    public TechnicianSummary getTechnician() { return technician; }
    public Double getTravelTimeMinutes() { return travelTimeMinutes; }
    public String getStartTime() { return startTime; }
    public String getEndTime() { return endTime; }
    public String getTimeStatus() { return timeStatus; }
    public String getError() { return error; }
    public String getMessage() { return message; }

    public static class TechnicianSummary {
        private final String technicianId;
        private final String name;
        private final String phone;
        private final String area;

        TechnicianSummary(Technician technician) {
            this.technicianId = technician.getTechnicianId();
            this.name = technician.getName();
            this.phone = technician.getPhone();
            this.area = technician.getArea();
        }

        public String getTechnicianId() { return technicianId; }
        public String getName() { return name; }
        public String getPhone() { return phone; }
        public String getArea() { return area; }
    }
}
