package com.cleanbear.assignment.model;

import com.cleanbear.assignment.util.TimeFormats;

import java.time.LocalTime;

/**
 * Operating policy for one assignment run.
 */
public final class SystemRules {

    public static final LocalTime DEFAULT_WORK_START = LocalTime.of(9, 0);
    public static final LocalTime DEFAULT_WORK_END = LocalTime.of(18, 0);
    public static final int DEFAULT_MAX_PREASSIGN_DAYS = 3;
    public static final int DEFAULT_BUFFER_MIN = 30;
    public static final LocalTime MIDDAY = LocalTime.NOON;

    private final LocalTime workStart;
    private final LocalTime workEnd;
    private final int maxPreassignDays;
    private final int defaultBufferMin;

    public SystemRules(LocalTime workStart, LocalTime workEnd, int maxPreassignDays, int defaultBufferMin) {
        if (workStart == null || workEnd == null) {
            throw new IllegalArgumentException("work_start and work_end are required");
        }
        if (!workEnd.isAfter(workStart)) {
            throw new IllegalArgumentException(
                    "work_end " + workEnd + " must be after work_start " + workStart);
        }
        if (maxPreassignDays < 1) {
            throw new IllegalArgumentException("max_preassign_days must be at least 1, got " + maxPreassignDays);
        }
        if (defaultBufferMin < 0) {
            throw new IllegalArgumentException("default_buffer_min must not be negative, got " + defaultBufferMin);
        }
        this.workStart = workStart;
        this.workEnd = workEnd;
        this.maxPreassignDays = maxPreassignDays;
        this.defaultBufferMin = defaultBufferMin;
    }

    public static SystemRules defaults() {
        return new SystemRules(DEFAULT_WORK_START, DEFAULT_WORK_END,
                DEFAULT_MAX_PREASSIGN_DAYS, DEFAULT_BUFFER_MIN);
    }

    public LocalTime getWorkStart() { return workStart; }
    public LocalTime getWorkEnd() { return workEnd; }
    public int getMaxPreassignDays() { return maxPreassignDays; }
    public int getDefaultBufferMin() { return defaultBufferMin; }

    public int getWorkStartMinutes() {
        return TimeFormats.toMinutes(workStart);
    }

    public int getWorkEndMinutes() {
        return TimeFormats.toMinutes(workEnd);
    }

    /**
     * Earliest start for an unfixed job with the given slot hint. The afternoon
     * slot opens at noon unless the working day itself starts later.
     */
    public int slotWindowStart(SlotType slotType) {
        if (slotType == SlotType.AFTERNOON) {
            return Math.max(getWorkStartMinutes(), TimeFormats.toMinutes(MIDDAY));
        }
        return getWorkStartMinutes();
    }

    /**
     * Latest end for an unfixed job with the given slot hint. The morning slot
     * closes at noon; when the working day starts at or after noon there is no
     * morning and the whole day is used.
     */
    public int slotWindowEnd(SlotType slotType) {
        int midday = TimeFormats.toMinutes(MIDDAY);
        if (slotType == SlotType.MORNING && getWorkStartMinutes() < midday) {
            return Math.min(midday, getWorkEndMinutes());
        }
        return getWorkEndMinutes();
    }

    @Override
    public String toString() {
        return "SystemRules{" + workStart + "-" + workEnd
                + ", maxDays=" + maxPreassignDays + ", buffer=" + defaultBufferMin + "}";
    }
}
