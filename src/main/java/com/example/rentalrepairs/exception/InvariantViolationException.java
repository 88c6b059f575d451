package com.example.rentalrepairs.exception;

/**
 * An operation would break a domain invariant. Nothing has been changed when this is thrown.
 */
public class InvariantViolationException extends DomainException {

    private final InvariantRule rule;

    public InvariantViolationException(InvariantRule rule, String aggregateType, Object aggregateId, String message) {
        super(message, aggregateType, aggregateId);
        this.rule = rule;
    }

    public InvariantRule getRule() {
        return rule;
    }
}
