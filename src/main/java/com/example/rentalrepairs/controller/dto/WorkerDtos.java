package com.example.rentalrepairs.controller.dto;

import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.UUID;

public final class WorkerDtos {

    private WorkerDtos() {
    }

    public record RegisterWorkerRequest(
            @NotBlank @Email String email,
            @NotBlank String fullName,
            @NotBlank String specialization) {
    }

    public record ChangeSpecializationRequest(@NotBlank String specialization) {
    }

    public record WorkerResponse(
            UUID id,
            String email,
            String fullName,
            WorkerSpecialization specialization,
            boolean active,
            boolean available,
            List<UUID> assignedRequestIds) {

        public static WorkerResponse from(Worker worker) {
            return new WorkerResponse(worker.getId(), worker.getEmail(), worker.getFullName(),
                    worker.getSpecialization(), worker.isActive(), worker.isAvailable(),
                    worker.getAssignedRequestIds());
        }
    }
}
