package com.example.rentalrepairs.model.enums;

public enum AssignmentRejectionReason {

    SPECIALIZATION_MISMATCH("worker specialization does not match the request"),
    WORKER_INACTIVE("worker is not active"),
    WORKER_UNAVAILABLE("worker is not available"),
    WORKER_AT_CAPACITY("worker is at the concurrent assignment limit"),
    ALREADY_ASSIGNED("worker is already assigned to this request");

    private final String description;

    AssignmentRejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
