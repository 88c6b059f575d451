package com.example.rentalrepairs.events;

import com.example.rentalrepairs.model.enums.TenantRequestStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published on topic "request.status-changed" for every status transition.
 *
 * @param assignedWorkerId worker holding the request after the transition, if any
 * @param reason           decline or escalation reason, completion notes, otherwise {@code null}
 */
public record RequestStatusChangedEvent(
        UUID requestId,
        String requestCode,
        UUID propertyId,
        UUID tenantId,
        TenantRequestStatus previousStatus,
        TenantRequestStatus newStatus,
        UUID assignedWorkerId,
        String reason,
        String actorId,
        LocalDateTime occurredAt) {
}
