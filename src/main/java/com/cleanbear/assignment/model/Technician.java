package com.cleanbear.assignment.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A field technician. Required scheduling fields may be null here; the engine
 * screens them out before matching.
 */
public final class Technician {

    private final String technicianId;
    private final String name;
    private final String phone;
    private final String area;
    private final Coordinate home;
    private final Set<String> serviceTypes;
    private final Boolean overtimeAllowed;

    private Technician(Builder builder) {
        this.technicianId = builder.technicianId;
        this.name = builder.name;
        this.phone = builder.phone;
        this.area = builder.area;
        this.home = builder.home;
        this.serviceTypes = builder.serviceTypes == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.serviceTypes));
        this.overtimeAllowed = builder.overtimeAllowed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTechnicianId() { return technicianId; }
    public String getName() { return name; }
    public String getPhone() { return phone; }
    public String getArea() { return area; }
    public Coordinate getHome() { return home; }
    public Set<String> getServiceTypes() { return serviceTypes; }
    public Boolean getOvertimeAllowed() { return overtimeAllowed; }

    public boolean isOvertimeAllowed() {
        return Boolean.TRUE.equals(overtimeAllowed);
    }

    public boolean canHandle(String serviceType) {
        return serviceTypes != null && serviceTypes.contains(serviceType);
    }

    @Override
    public String toString() {
        return "Technician{" + technicianId + ", " + serviceTypes + "}";
    }

    public static final class Builder {
        private String technicianId;
        private String name;
        private String phone;
        private String area;
        private Coordinate home;
        private Set<String> serviceTypes;
        private Boolean overtimeAllowed;

        public Builder technicianId(String technicianId) {
            this.technicianId = technicianId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder area(String area) {
            this.area = area;
            return this;
        }

        public Builder home(Coordinate home) {
            this.home = home;
            return this;
        }

        public Builder serviceTypes(Set<String> serviceTypes) {
            this.serviceTypes = serviceTypes;
            return this;
        }

        public Builder overtimeAllowed(Boolean overtimeAllowed) {
            this.overtimeAllowed = overtimeAllowed;
            return this;
        }

        public Technician build() {
            return new Technician(this);
        }
    }
}
