package com.cleanbear.assignment.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A cleaning job as the engine sees it. The location is already a coordinate;
 * fields the caller omitted are null, and values that could not be parsed are
 * listed in {@link #getInputErrors()} keyed by their wire field name.
 */
public final class Job {

    private final String jobId;
    private final String serviceType;
    private final Coordinate location;
    private final String address;
    private final boolean locationUnresolved;
    private final LocalDate date;
    private final Integer durationMin;
    private final boolean timeFixed;
    private final LocalTime fixedStartTime;
    private final SlotType slotType;
    private final Map<String, String> inputErrors;

    private Job(Builder builder) {
        this.jobId = builder.jobId;
        this.serviceType = builder.serviceType;
        this.location = builder.location;
        this.address = builder.address;
        this.locationUnresolved = builder.locationUnresolved;
        this.date = builder.date;
        this.durationMin = builder.durationMin;
        this.timeFixed = builder.timeFixed;
        this.fixedStartTime = builder.fixedStartTime;
        this.slotType = builder.slotType;
        this.inputErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputErrors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getJobId() { return jobId; }
    public String getServiceType() { return serviceType; }
    public Coordinate getLocation() { return location; }
    public String getAddress() { return address; }
    public boolean isLocationUnresolved() { return locationUnresolved; }
    public LocalDate getDate() { return date; }
    public Integer getDurationMin() { return durationMin; }
    public boolean isTimeFixed() { return timeFixed; }
    public LocalTime getFixedStartTime() { return fixedStartTime; }
    public SlotType getSlotType() { return slotType; }
    public Map<String, String> getInputErrors() { return inputErrors; }

    @Override
    public String toString() {
        return "Job{" + jobId + ", " + serviceType + ", " + date
                + (timeFixed ? " @" + fixedStartTime : "") + "}";
    }

    public static final class Builder {
        private String jobId;
        private String serviceType;
        private Coordinate location;
        private String address;
        private boolean locationUnresolved;
        private LocalDate date;
        private Integer durationMin;
        private boolean timeFixed;
        private LocalTime fixedStartTime;
        private SlotType slotType;
        private final Map<String, String> inputErrors = new LinkedHashMap<>();

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder location(Coordinate location) {
            this.location = location;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder locationUnresolved(boolean locationUnresolved) {
            this.locationUnresolved = locationUnresolved;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder durationMin(Integer durationMin) {
            this.durationMin = durationMin;
            return this;
        }

        public Builder timeFixed(boolean timeFixed) {
            this.timeFixed = timeFixed;
            return this;
        }

        public Builder fixedStartTime(LocalTime fixedStartTime) {
            this.fixedStartTime = fixedStartTime;
            return this;
        }

        public Builder slotType(SlotType slotType) {
            this.slotType = slotType;
            return this;
        }

        public Builder inputError(String field, String message) {
            this.inputErrors.put(field, message);
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
