package com.example.rentalrepairs.exception;

/**
 * The aggregate was changed by someone else since it was read. Retry belongs to the caller.
 */
public class ConcurrencyConflictException extends DomainException {

    public ConcurrencyConflictException(String aggregateType, Object aggregateId, Throwable cause) {
        super(aggregateType + " " + aggregateId + " was modified concurrently", aggregateType, aggregateId, cause);
    }
}
