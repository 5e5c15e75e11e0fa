package com.cleanbear.assignment.dto;

public class ErrorResponse {

    private final boolean success = false;
    private final String error;

    public ErrorResponse(String error) {
        this.error = error;
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
}
