package com.example.rentalrepairs.events;

import com.example.rentalrepairs.model.enums.WorkerSpecialization;

import java.time.LocalDateTime;
import java.util.UUID;

public record WorkerAssignedEvent(
        UUID requestId,
        String requestCode,
        UUID propertyId,
        UUID workerId,
        String workerEmail,
        WorkerSpecialization requiredSpecialization,
        WorkerSpecialization workerSpecialization,
        String actorId,
        LocalDateTime occurredAt) {
}
