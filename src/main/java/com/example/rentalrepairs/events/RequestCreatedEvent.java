package com.example.rentalrepairs.events;

import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published on topic "request.created" once a tenant's request is filed.
 */
public record RequestCreatedEvent(
        UUID requestId,
        String requestCode,
        UUID propertyId,
        UUID tenantId,
        String title,
        WorkerSpecialization requiredSpecialization,
        TenantRequestUrgency urgency,
        String actorId,
        LocalDateTime occurredAt) {
}
