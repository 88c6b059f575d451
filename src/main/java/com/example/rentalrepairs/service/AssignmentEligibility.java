package com.example.rentalrepairs.service;

import com.example.rentalrepairs.exception.WorkerAssignmentException;
import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;

import java.util.UUID;

/**
 * Outcome of an eligibility check: either eligible, or the single reason it is not.
 */
public record AssignmentEligibility(AssignmentRejectionReason rejectionReason) {

    private static final AssignmentEligibility ELIGIBLE = new AssignmentEligibility(null);

    public static AssignmentEligibility eligible() {
        return ELIGIBLE;
    }

    public static AssignmentEligibility rejected(AssignmentRejectionReason reason) {
        return new AssignmentEligibility(reason);
    }

    public boolean isEligible() {
        return rejectionReason == null;
    }

    public void orThrow(UUID requestId, UUID workerId) {
        if (!isEligible()) {
            throw new WorkerAssignmentException(requestId, workerId, rejectionReason);
        }
    }
}
