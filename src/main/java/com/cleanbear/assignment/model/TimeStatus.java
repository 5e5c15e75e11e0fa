package com.cleanbear.assignment.model;

public enum TimeStatus {
    FIXED("fixed"),
    COMPUTED("computed"),
    // Shown to the customer as "time to be confirmed"; a best-effort time is still used internally.
    TO_BE_CONFIRMED("undefined");

    private final String wireName;

    TimeStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
