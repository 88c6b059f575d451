package com.example.rentalrepairs.service;

import com.example.rentalrepairs.config.RentalRepairsProperties;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.GeneralFallbackPolicy;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.specification.WorkerSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds workers for a request through worker specifications, and applies the configured
 * general-maintenance fallback.
 */
@Service
public class WorkerMatchingService {

    private static final Logger log = LoggerFactory.getLogger(WorkerMatchingService.class);

    private final WorkerRepository workerRepository;
    private final GeneralFallbackPolicy fallbackPolicy;
    private final int maxConcurrentAssignments;

    public WorkerMatchingService(WorkerRepository workerRepository, RentalRepairsProperties properties) {
        this.workerRepository = workerRepository;
        this.fallbackPolicy = properties.assignment().generalFallback();
        this.maxConcurrentAssignments = properties.assignment().maxConcurrentAssignments();
    }

    public boolean isGeneralFallbackPermitted(WorkerSpecialization required) {
        if (required == WorkerSpecialization.GENERAL_MAINTENANCE) {
            return false;
        }
        return switch (fallbackPolicy) {
            case NEVER -> false;
            case ALWAYS -> true;
            case WHEN_NO_SPECIALIST_AVAILABLE ->
                    workerRepository.count(WorkerSpecifications.eligibleFor(required, maxConcurrentAssignments)) == 0;
        };
    }

    /**
     * Specialists first, then general-maintenance workers when the fallback applies; each group
     * least loaded first.
     */
    public List<Worker> findEligibleWorkers(TenantRequest request) {
        WorkerSpecialization required = request.getRequiredSpecialization();
        List<Worker> candidates = new ArrayList<>(
                workerRepository.find(WorkerSpecifications.eligibleFor(required, maxConcurrentAssignments)));
        if (isGeneralFallbackPermitted(required)) {
            candidates.addAll(workerRepository.find(
                    WorkerSpecifications.eligibleFor(WorkerSpecialization.GENERAL_MAINTENANCE, maxConcurrentAssignments)));
        }
        log.debug("Found {} eligible workers for request={} specialization={} fallback={}",
                candidates.size(), request.getId(), required, fallbackPolicy);
        return candidates;
    }
}
