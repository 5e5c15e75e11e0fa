package com.cleanbear.assignment.dto;

/**
 * Per-request overrides of the configured scheduling rules. Null fields keep the default.
 */
public class SystemRulesRequest {

    private String workStart;
    private String workEnd;
    private Integer maxPreassignDays;
    private Integer defaultBufferMin;

    public SystemRulesRequest() {}

    public String getWorkStart() { return workStart; }
    public String getWorkEnd() { return workEnd; }
    public Integer getMaxPreassignDays() { return maxPreassignDays; }
    public Integer getDefaultBufferMin() { return defaultBufferMin; }

    public void setWorkStart(String workStart) { this.workStart = workStart; }
    public void setWorkEnd(String workEnd) { this.workEnd = workEnd; }
    public void setMaxPreassignDays(Integer maxPreassignDays) { this.maxPreassignDays = maxPreassignDays; }
    public void setDefaultBufferMin(Integer defaultBufferMin) { this.defaultBufferMin = defaultBufferMin; }
}
