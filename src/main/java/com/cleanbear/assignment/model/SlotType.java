package com.cleanbear.assignment.model;

/**
 * Preferred part of the day for a job whose start time is not fixed.
 */
public enum SlotType {
    MORNING,
    AFTERNOON,
    ALLDAY;

    /**
     * Accepts the English names (any case) and the Korean labels used by the
     * booking sheet. Returns null when the value is not recognised.
     */
    public static SlotType parse(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        switch (value.toUpperCase()) {
            case "MORNING": case "AM": return MORNING;
            case "AFTERNOON": case "PM": return AFTERNOON;
            case "ALLDAY": case "ALL_DAY": case "FULL_DAY": return ALLDAY;
            default: break;
        }
        switch (value) {
            case "오전": return MORNING;
            case "오후": return AFTERNOON;
            case "상관없음": case "종일": return ALLDAY;
            default: return null;
        }
    }
}
