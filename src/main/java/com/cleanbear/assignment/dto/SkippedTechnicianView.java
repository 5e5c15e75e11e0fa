package com.cleanbear.assignment.dto;

import com.cleanbear.assignment.model.SkippedTechnician;

import java.util.List;

public class SkippedTechnicianView {

    private String technicianId;
    private String reason;
    private List<String> missingFields;

    public SkippedTechnicianView() {}

    public static SkippedTechnicianView from(SkippedTechnician skipped) {
        SkippedTechnicianView view = new SkippedTechnicianView();
        view.technicianId = skipped.getTechnicianId();
        view.reason = skipped.getReason();
        view.missingFields = skipped.getMissingFields();
        return view;
    }

    public String getTechnicianId() { return technicianId; }
    public String getReason() { return reason; }
    public List<String> getMissingFields() { return missingFields; }
}
