package com.example.rentalrepairs.service;

import com.example.rentalrepairs.config.RentalRepairsProperties;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import org.springframework.stereotype.Component;

/**
 * Decides whether one worker may take one request. Pure: reads both aggregates, changes neither.
 *
 * Whether a general-maintenance worker may stand in for a missing specialist is decided by the
 * caller ({@link WorkerMatchingService#isGeneralFallbackPermitted}) and passed in.
 */
@Component
public class WorkerAssignmentPolicy {

    private final int maxConcurrentAssignments;

    public WorkerAssignmentPolicy(RentalRepairsProperties properties) {
        this.maxConcurrentAssignments = properties.assignment().maxConcurrentAssignments();
    }

    public AssignmentEligibility canBeAssigned(Worker worker, TenantRequest request, boolean generalFallbackPermitted) {
        if (!worker.isActive()) {
            return AssignmentEligibility.rejected(AssignmentRejectionReason.WORKER_INACTIVE);
        }
        if (worker.isAssignedTo(request.getId())) {
            return AssignmentEligibility.rejected(AssignmentRejectionReason.ALREADY_ASSIGNED);
        }
        if (!matchesSpecialization(worker.getSpecialization(), request.getRequiredSpecialization(), generalFallbackPermitted)) {
            return AssignmentEligibility.rejected(AssignmentRejectionReason.SPECIALIZATION_MISMATCH);
        }
        if (worker.getAssignedRequestIds().size() >= maxConcurrentAssignments) {
            return AssignmentEligibility.rejected(AssignmentRejectionReason.WORKER_AT_CAPACITY);
        }
        if (!worker.isAvailable()) {
            return AssignmentEligibility.rejected(AssignmentRejectionReason.WORKER_UNAVAILABLE);
        }
        return AssignmentEligibility.eligible();
    }

    public int getMaxConcurrentAssignments() {
        return maxConcurrentAssignments;
    }

    private static boolean matchesSpecialization(WorkerSpecialization workerSpecialization,
                                                 WorkerSpecialization required,
                                                 boolean generalFallbackPermitted) {
        if (workerSpecialization == required) {
            return true;
        }
        return generalFallbackPermitted && workerSpecialization == WorkerSpecialization.GENERAL_MAINTENANCE;
    }
}
