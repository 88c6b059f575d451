package com.example.rentalrepairs.controller.dto;

import com.example.rentalrepairs.model.entity.StatusTransition;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public final class RequestDtos {

    private RequestDtos() {
    }

    public record SubmitRequest(
            @NotNull UUID propertyId,
            @NotNull UUID tenantId,
            @NotBlank @Size(max = 200) String title,
            @NotBlank @Size(max = 4000) String description,
            String categoryHint,
            String urgency) {
    }

    public record AssignWorkerRequest(@NotNull UUID workerId) {
    }

    public record ReasonRequest(@NotBlank @Size(max = 1000) String reason) {
    }

    public record CompleteRequest(@Size(max = 2000) String notes) {
    }

    public record TransitionResponse(
            TenantRequestStatus fromStatus,
            TenantRequestStatus toStatus,
            String actorId,
            LocalDateTime occurredAt,
            String note) {

        static TransitionResponse from(StatusTransition transition) {
            return new TransitionResponse(transition.getFromStatus(), transition.getToStatus(),
                    transition.getActorId(), transition.getOccurredAt(), transition.getNote());
        }
    }

    public record RequestResponse(
            UUID id,
            String code,
            UUID propertyId,
            UUID tenantId,
            String title,
            String description,
            WorkerSpecialization requiredSpecialization,
            TenantRequestUrgency urgency,
            TenantRequestStatus status,
            UUID assignedWorkerId,
            LocalDateTime submittedAt,
            LocalDateTime dueAt,
            LocalDateTime completedAt,
            List<TransitionResponse> history) {

        public static RequestResponse from(TenantRequest request) {
            return new RequestResponse(request.getId(), request.getCode(), request.getPropertyId(),
                    request.getTenantId(), request.getTitle(), request.getDescription(),
                    request.getRequiredSpecialization(), request.getUrgency(), request.getStatus(),
                    request.getAssignedWorkerId(), request.getSubmittedAt(), request.getDueAt(),
                    request.getCompletedAt(),
                    request.getHistory().stream().map(TransitionResponse::from).toList());
        }
    }
}
