package com.cleanbear.assignment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RosterRefreshResponse {

    private boolean success;
    private Integer technicianCount;
    private String error;

    public RosterRefreshResponse() {}

    public static RosterRefreshResponse refreshed(int technicianCount) {
        RosterRefreshResponse response = new RosterRefreshResponse();
        response.success = true;
        response.technicianCount = technicianCount;
        return response;
    }

    public static RosterRefreshResponse failed(String error) {
        RosterRefreshResponse response = new RosterRefreshResponse();
        response.success = false;
        response.error = error;
        return response;
    }

    public boolean isSuccess() { return success; }
    public Integer getTechnicianCount() { return technicianCount; }
    public String getError() { return error; }
}
