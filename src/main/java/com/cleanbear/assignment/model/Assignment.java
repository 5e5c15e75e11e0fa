package com.cleanbear.assignment.model;

/**
 * A job placed on a technician's schedule.
 */
public final class Assignment {

    private final Job job;
    private final Technician technician;
    private final TimeInterval interval;
    private final TimeStatus timeStatus;
    private final double travelMinutes;

    public Assignment(Job job, Technician technician, TimeInterval interval,
                      TimeStatus timeStatus, double travelMinutes) {
        this.job = job;
        this.technician = technician;
        this.interval = interval;
        this.timeStatus = timeStatus;
        this.travelMinutes = travelMinutes;
    }

    public Job getJob() { return job; }
    public Technician getTechnician() { return technician; }
    public TimeInterval getInterval() { return interval; }
    public TimeStatus getTimeStatus() { return timeStatus; }
    public double getTravelMinutes() { return travelMinutes; }

    public String getJobId() {
        return job.getJobId();
    }

    public String getTechnicianId() {
        return technician.getTechnicianId();
    }

    public boolean isTimeConfirmed() {
        return timeStatus != TimeStatus.TO_BE_CONFIRMED;
    }

    @Override
    public String toString() {
        return "Assignment{" + job.getJobId() + " -> " + technician.getTechnicianId()
                + " " + job.getDate() + " " + interval + " " + timeStatus + "}";
    }
}
