package com.example.rentalrepairs.events;

import com.example.rentalrepairs.model.enums.WorkerSpecialization;

import java.time.LocalDateTime;
import java.util.UUID;

public record WorkerSpecializationChangedEvent(
        UUID workerId,
        String workerEmail,
        WorkerSpecialization previousSpecialization,
        WorkerSpecialization newSpecialization,
        String actorId,
        LocalDateTime occurredAt) {
}
