package com.cleanbear.assignment.dto;

import com.cleanbear.assignment.model.Job;
import com.cleanbear.assignment.model.JobOutcome;

/**
 * A failed or deferred job as reported back to the caller.
 */
public class RejectedJobView {

    private String jobId;
    private String date;
    private String serviceType;
    private String status;
    private String errorReason;
    private String detail;

    public RejectedJobView() {}

    public static RejectedJobView from(JobOutcome outcome) {
        Job job = outcome.getJob();
        RejectedJobView view = new RejectedJobView();
        view.jobId = job.getJobId();
        view.date = job.getDate() != null ? job.getDate().toString() : null;
        view.serviceType = job.getServiceType();
        view.status = outcome.getReason().isDeferral() ? "deferred" : "failed";
        view.errorReason = outcome.getReason().name();
        view.detail = outcome.getDetail();
        return view;
    }

    public String getJobId() { return jobId; }
    public String getDate() { return date; }
    public String getServiceType() { return serviceType; }
    public String getStatus() { return status; }
    public String getErrorReason() { return errorReason; }
    public String getDetail() { return detail; }
}
