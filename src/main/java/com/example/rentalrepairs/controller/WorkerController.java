package com.example.rentalrepairs.controller;

import com.example.rentalrepairs.controller.dto.WorkerDtos.ChangeSpecializationRequest;
import com.example.rentalrepairs.controller.dto.WorkerDtos.RegisterWorkerRequest;
import com.example.rentalrepairs.controller.dto.WorkerDtos.WorkerResponse;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.service.RegisterWorkerCommand;
import com.example.rentalrepairs.service.WorkerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/workers")
public class WorkerController {

    private final WorkerService workerService;

    public WorkerController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping
    public ResponseEntity<WorkerResponse> register(@Valid @RequestBody RegisterWorkerRequest body) {
        Worker worker = workerService.registerWorker(
                new RegisterWorkerCommand(body.email(), body.fullName(), body.specialization()));
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkerResponse.from(worker));
    }

    @GetMapping("/{workerId}")
    public WorkerResponse get(@PathVariable UUID workerId) {
        return WorkerResponse.from(workerService.getWorker(workerId));
    }

    @PutMapping("/{workerId}/specialization")
    public WorkerResponse changeSpecialization(@RequestHeader(TenantRequestController.USER_HEADER) String userId,
                                               @PathVariable UUID workerId,
                                               @Valid @RequestBody ChangeSpecializationRequest body) {
        return WorkerResponse.from(workerService.changeSpecialization(workerId, body.specialization(), userId));
    }

    @PostMapping("/{workerId}/activate")
    public WorkerResponse activate(@PathVariable UUID workerId) {
        return WorkerResponse.from(workerService.activate(workerId));
    }

    @PostMapping("/{workerId}/deactivate")
    public WorkerResponse deactivate(@PathVariable UUID workerId) {
        return WorkerResponse.from(workerService.deactivate(workerId));
    }
}
