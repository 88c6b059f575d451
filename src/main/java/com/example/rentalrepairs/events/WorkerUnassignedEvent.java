package com.example.rentalrepairs.events;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A worker lost a request through decline, escalation or reassignment.
 */
public record WorkerUnassignedEvent(
        UUID requestId,
        String requestCode,
        UUID workerId,
        String workerEmail,
        String reason,
        String actorId,
        LocalDateTime occurredAt) {
}
