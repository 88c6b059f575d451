package com.example.rentalrepairs.specification;

import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.UUID;

public final class TenantRequestSpecifications {

    private TenantRequestSpecifications() {
    }

    public static Specification<TenantRequest> byStatus(TenantRequestStatus status) {
        return Specification.equal("status", TenantRequest::getStatus, status);
    }

    public static Specification<TenantRequest> byStatuses(Collection<TenantRequestStatus> statuses) {
        return Specification.in("status", TenantRequest::getStatus, statuses);
    }

    public static Specification<TenantRequest> byProperty(UUID propertyId) {
        return Specification.equal("propertyId", TenantRequest::getPropertyId, propertyId);
    }

    public static Specification<TenantRequest> byTenant(UUID tenantId) {
        return Specification.equal("tenantId", TenantRequest::getTenantId, tenantId);
    }

    public static Specification<TenantRequest> assignedTo(UUID workerId) {
        return Specification.equal("assignedWorkerId", TenantRequest::getAssignedWorkerId, workerId);
    }

    public static Specification<TenantRequest> requiringSpecialization(WorkerSpecialization specialization) {
        return Specification.equal("requiredSpecialization", TenantRequest::getRequiredSpecialization, specialization);
    }

    public static Specification<TenantRequest> byUrgency(TenantRequestUrgency urgency) {
        return Specification.equal("urgency", TenantRequest::getUrgency, urgency);
    }

    /** Not yet COMPLETED or DECLINED. */
    public static Specification<TenantRequest> open() {
        EnumSet<TenantRequestStatus> openStatuses = EnumSet.noneOf(TenantRequestStatus.class);
        Arrays.stream(TenantRequestStatus.values())
                .filter(status -> !status.isTerminal())
                .forEach(openStatuses::add);
        return byStatuses(openStatuses);
    }

    /**
     * Open requests of the given urgency whose expected resolution time has passed, oldest first.
     */
    public static Specification<TenantRequest> overdue(TenantRequestUrgency urgency, LocalDateTime now) {
        return byUrgency(urgency)
                .and(open())
                .and(Specification.lessThan("dueAt", TenantRequest::getDueAt, now))
                .orderBy("dueAt");
    }

    /** Open requests still holding a worker's capacity. */
    public static Specification<TenantRequest> activeAssignmentsOf(UUID workerId) {
        return assignedTo(workerId)
                .and(byStatuses(EnumSet.of(TenantRequestStatus.ASSIGNED, TenantRequestStatus.IN_PROGRESS)));
    }
}
