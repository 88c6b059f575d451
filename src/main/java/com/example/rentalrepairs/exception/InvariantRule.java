package com.example.rentalrepairs.exception;

public enum InvariantRule {
    STATUS_TRANSITION,
    TERMINAL_REQUEST_IMMUTABLE,
    WORKER_ASSIGNMENT,
    SPECIALIZATION_CHANGE_CONFLICT,
    PROPERTY_INACTIVE,
    TENANT_NOT_OF_PROPERTY,
    UNIT_UNAVAILABLE,
    DUPLICATE_TENANT,
    DUPLICATE_WORKER,
    DUPLICATE_PROPERTY
}
