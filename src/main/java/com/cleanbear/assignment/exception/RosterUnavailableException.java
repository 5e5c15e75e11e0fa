package com.cleanbear.assignment.exception;

/**
 * The technician roster source could not be read.
 */
public class RosterUnavailableException extends RuntimeException {

    public RosterUnavailableException(String message) {
        super(message);
    }

    public RosterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
