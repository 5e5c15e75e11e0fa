package com.cleanbear.assignment.model;

import java.util.List;

public final class SkippedTechnician {

    private final String technicianId;
    private final String reason;
    private final List<String> missingFields;

    public SkippedTechnician(String technicianId, String reason, List<String> missingFields) {
        this.technicianId = technicianId;
        this.reason = reason;
        this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public String getTechnicianId() { return technicianId; }
    public String getReason() { return reason; }
    public List<String> getMissingFields() { return missingFields; }
}
