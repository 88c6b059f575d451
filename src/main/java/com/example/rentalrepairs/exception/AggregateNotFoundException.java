package com.example.rentalrepairs.exception;

public class AggregateNotFoundException extends DomainException {

    public AggregateNotFoundException(String aggregateType, Object aggregateId) {
        super("No " + aggregateType + " found with id " + aggregateId, aggregateType, aggregateId);
    }
}
