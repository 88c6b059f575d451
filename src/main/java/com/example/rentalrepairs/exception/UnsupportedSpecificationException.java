package com.example.rentalrepairs.exception;

/**
 * A specification uses something the store adapter cannot translate. Raised while the store
 * query is being built, never from inside a running query.
 */
public class UnsupportedSpecificationException extends RuntimeException {

    public UnsupportedSpecificationException(String message) {
        super(message);
    }
}
