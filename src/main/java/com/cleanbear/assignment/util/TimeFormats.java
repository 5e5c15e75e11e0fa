package com.cleanbear.assignment.util;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Clock-time helpers. The scheduler works in minutes since midnight so that a job
 * running past midnight (overtime) can still be represented and printed.
 */
public final class TimeFormats {

    private static final DateTimeFormatter[] TIME_FORMATTERS = {
            DateTimeFormatter.ofPattern("HH:mm:ss"),
            DateTimeFormatter.ofPattern("H:mm:ss"),
            DateTimeFormatter.ofPattern("HH:mm"),
            DateTimeFormatter.ofPattern("H:mm")
    };

    private TimeFormats() {}

    /**
     * Parses "14:30", "9:30" or "14:30:00". Returns null for blank or unparsable input.
     */
    public static LocalTime parseTime(String timeStr) {
        if (timeStr == null || timeStr.isBlank()) {
            return null;
        }

        for (DateTimeFormatter formatter : TIME_FORMATTERS) {
            try {
                return LocalTime.parse(timeStr.trim(), formatter);
            } catch (DateTimeParseException e) {
                // Try next formatter
            }
        }

        return null;
    }

    /**
     * Parses an ISO date (YYYY-MM-DD). Returns null for blank or unparsable input.
     */
    public static LocalDate parseDate(String dateStr) {
        if (dateStr == null || dateStr.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(dateStr.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    /**
     * Formats minutes since midnight as HH:mm; hours past 23 are kept as-is ("25:10").
     */
    public static String format(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }
}
