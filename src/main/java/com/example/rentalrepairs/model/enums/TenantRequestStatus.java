package com.example.rentalrepairs.model.enums;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a tenant request.
 *
 * SUBMITTED → IN_REVIEW → ASSIGNED → IN_PROGRESS → COMPLETED
 * DECLINED is reachable from SUBMITTED, IN_REVIEW and ASSIGNED.
 * ESCALATED is reachable from IN_REVIEW, ASSIGNED and IN_PROGRESS and always returns to IN_REVIEW.
 */
public enum TenantRequestStatus {

    SUBMITTED,
    IN_REVIEW,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    DECLINED,
    ESCALATED;

    private static final Map<TenantRequestStatus, Set<TenantRequestStatus>> ALLOWED_TRANSITIONS = Map.of(
            SUBMITTED, Set.of(IN_REVIEW, DECLINED),
            IN_REVIEW, Set.of(ASSIGNED, DECLINED, ESCALATED),
            ASSIGNED, Set.of(IN_PROGRESS, DECLINED, ESCALATED),
            IN_PROGRESS, Set.of(COMPLETED, ESCALATED),
            ESCALATED, Set.of(IN_REVIEW),
            COMPLETED, Set.of(),
            DECLINED, Set.of());

    private static final Set<TenantRequestStatus> WORKER_BOUND = EnumSet.of(ASSIGNED, IN_PROGRESS, COMPLETED);

    public Set<TenantRequestStatus> allowedTransitions() {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
    }

    public boolean canTransitionTo(TenantRequestStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DECLINED;
    }

    /** A request in one of these states must reference a worker; in any other it must not. */
    public boolean requiresAssignedWorker() {
        return WORKER_BOUND.contains(this);
    }

    /** States that still hold a worker's capacity. */
    public boolean holdsWorkerCapacity() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }
}
