package com.example.rentalrepairs.exception;

import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;

import java.util.UUID;

public class WorkerAssignmentException extends InvariantViolationException {

    private final AssignmentRejectionReason reason;
    private final UUID workerId;

    public WorkerAssignmentException(UUID requestId, UUID workerId, AssignmentRejectionReason reason) {
        super(InvariantRule.WORKER_ASSIGNMENT, "TenantRequest", requestId,
                "Worker " + workerId + " cannot be assigned to request " + requestId + ": " + reason.getDescription());
        this.reason = reason;
        this.workerId = workerId;
    }

    public AssignmentRejectionReason getReason() {
        return reason;
    }

    public UUID getWorkerId() {
        return workerId;
    }
}
