package com.example.rentalrepairs.service;

import com.example.rentalrepairs.events.WorkerSpecializationChangedEvent;
import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.specification.Specification;
import com.example.rentalrepairs.specification.TenantRequestSpecifications;
import com.example.rentalrepairs.specification.WorkerSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private final WorkerRepository workerRepository;
    private final TenantRequestRepository requestRepository;
    private final WorkerAssignmentPolicy assignmentPolicy;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public WorkerService(WorkerRepository workerRepository,
                         TenantRequestRepository requestRepository,
                         WorkerAssignmentPolicy assignmentPolicy,
                         ApplicationEventPublisher publisher,
                         Clock clock) {
        this.workerRepository = workerRepository;
        this.requestRepository = requestRepository;
        this.assignmentPolicy = assignmentPolicy;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Transactional
    public Worker registerWorker(RegisterWorkerCommand command) {
        WorkerSpecialization specialization = WorkerSpecialization.parse(command.specialization());
        Worker worker = new Worker(command.email(), command.fullName(), specialization,
                assignmentPolicy.getMaxConcurrentAssignments(), LocalDateTime.now(clock));
        if (workerRepository.count(WorkerSpecifications.byEmail(worker.getEmail())) > 0) {
            throw duplicateWorker(worker);
        }
        try {
            workerRepository.add(worker);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same email
            throw duplicateWorker(worker);
        }
        log.info("[WORKER REGISTERED] worker={} specialization={}", worker.getEmail(), specialization);
        return worker;
    }

    /**
     * Audited specialization change, refused while an active assignment needs a trade the new
     * specialization cannot cover.
     */
    @Transactional
    public Worker changeSpecialization(UUID workerId, String specialization, String userId) {
        WorkerSpecialization target = WorkerSpecialization.parse(specialization);
        Worker worker = workerRepository.get(workerId);
        WorkerSpecialization previous = worker.getSpecialization();
        if (previous == target) {
            return worker;
        }

        List<WorkerSpecialization> activeRequirements = requestRepository
                .find(TenantRequestSpecifications.activeAssignmentsOf(workerId))
                .stream()
                .map(TenantRequest::getRequiredSpecialization)
                .toList();
        LocalDateTime now = LocalDateTime.now(clock);
        worker.changeSpecialization(target, activeRequirements, userId, now);
        workerRepository.update(worker);

        log.info("[EVENT → worker.specialization-changed] worker={} {} → {} by {}",
                worker.getEmail(), previous, target, userId);
        publisher.publishEvent(new WorkerSpecializationChangedEvent(worker.getId(), worker.getEmail(),
                previous, target, userId, now));
        return worker;
    }

    @Transactional
    public Worker activate(UUID workerId) {
        Worker worker = workerRepository.get(workerId);
        worker.activate(assignmentPolicy.getMaxConcurrentAssignments());
        workerRepository.update(worker);
        log.info("[WORKER ACTIVATED] worker={} available={}", worker.getEmail(), worker.isAvailable());
        return worker;
    }

    @Transactional
    public Worker deactivate(UUID workerId) {
        Worker worker = workerRepository.get(workerId);
        worker.deactivate(assignmentPolicy.getMaxConcurrentAssignments());
        workerRepository.update(worker);
        log.info("[WORKER DEACTIVATED] worker={} keeps {} active assignments",
                worker.getEmail(), worker.getActiveAssignmentCount());
        return worker;
    }

    @Transactional(readOnly = true)
    public Worker getWorker(UUID workerId) {
        return workerRepository.get(workerId);
    }

    @Transactional(readOnly = true)
    public List<Worker> findWorkers(Specification<Worker> specification) {
        return workerRepository.find(specification);
    }

    private static InvariantViolationException duplicateWorker(Worker worker) {
        return new InvariantViolationException(InvariantRule.DUPLICATE_WORKER, "Worker", worker.getEmail(),
                "A worker with email " + worker.getEmail() + " is already registered");
    }
}
