package com.example.rentalrepairs.exception;

/**
 * Malformed input to a constructor or command. Raised before anything is mutated.
 */
public class DomainValidationException extends DomainException {

    private final String field;

    public DomainValidationException(String field, String message) {
        super(message, null, null);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
