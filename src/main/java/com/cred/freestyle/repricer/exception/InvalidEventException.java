package com.cred.freestyle.repricer.exception;

/**
 * Exception thrown when an inbound event lacks the fields needed to process it.
 *
 * @author Repricer Team
 */
public class InvalidEventException extends RuntimeException {

    private final String field;

    public InvalidEventException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
