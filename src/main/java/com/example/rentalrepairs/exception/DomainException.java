package com.example.rentalrepairs.exception;

/**
 * Root of every rejection raised by the domain. Carries the aggregate the rejection is about so
 * callers can report it without parsing messages.
 */
public abstract class DomainException extends RuntimeException {

    private final String aggregateType;
    private final Object aggregateId;

    protected DomainException(String message, String aggregateType, Object aggregateId) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    protected DomainException(String message, String aggregateType, Object aggregateId, Throwable cause) {
        super(message, cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public Object getAggregateId() {
        return aggregateId;
    }
}
