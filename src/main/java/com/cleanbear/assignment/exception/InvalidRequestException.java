package com.cleanbear.assignment.exception;

/**
 * The request as a whole cannot be processed, e.g. contradictory system rules.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
