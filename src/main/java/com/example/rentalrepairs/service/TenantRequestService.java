package com.example.rentalrepairs.service;

import com.example.rentalrepairs.events.RequestCreatedEvent;
import com.example.rentalrepairs.events.RequestStatusChangedEvent;
import com.example.rentalrepairs.events.WorkerAssignedEvent;
import com.example.rentalrepairs.events.WorkerUnassignedEvent;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.RequestAction;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import com.example.rentalrepairs.repository.PropertyRepository;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.security.Principal;
import com.example.rentalrepairs.security.PrincipalRoleLookup;
import com.example.rentalrepairs.security.RequestAuthorizationPolicy;
import com.example.rentalrepairs.specification.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Drives the tenant request lifecycle.
 *
 * Every operation runs as one transaction. Checks come first, in this order: status graph,
 * authorization, then eligibility; only after all of them pass are the request and any worker
 * touched. Operations that change a request and a worker together write both inside that same
 * transaction, so a failure writing either one rolls back both.
 */
@Service
public class TenantRequestService {

    private static final Logger log = LoggerFactory.getLogger(TenantRequestService.class);

    private final TenantRequestRepository requestRepository;
    private final PropertyRepository propertyRepository;
    private final WorkerRepository workerRepository;
    private final SpecializationDeterminationService specializationService;
    private final WorkerAssignmentPolicy assignmentPolicy;
    private final WorkerMatchingService matchingService;
    private final PrincipalRoleLookup principalRoleLookup;
    private final RequestAuthorizationPolicy authorizationPolicy;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public TenantRequestService(TenantRequestRepository requestRepository,
                                PropertyRepository propertyRepository,
                                WorkerRepository workerRepository,
                                SpecializationDeterminationService specializationService,
                                WorkerAssignmentPolicy assignmentPolicy,
                                WorkerMatchingService matchingService,
                                PrincipalRoleLookup principalRoleLookup,
                                RequestAuthorizationPolicy authorizationPolicy,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.requestRepository = requestRepository;
        this.propertyRepository = propertyRepository;
        this.workerRepository = workerRepository;
        this.specializationService = specializationService;
        this.assignmentPolicy = assignmentPolicy;
        this.matchingService = matchingService;
        this.principalRoleLookup = principalRoleLookup;
        this.authorizationPolicy = authorizationPolicy;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Entry point: a tenant reports a problem.
     * Kafka analogy: producer publishes to topic "request.created"
     */
    @Transactional
    public TenantRequest submitRequest(SubmitRequestCommand command, String userId) {
        TenantRequestUrgency urgency = TenantRequestUrgency.parse(command.urgency());
        Property property = propertyRepository.get(command.propertyId());
        Principal principal = principalRoleLookup.resolve(userId);
        authorizationPolicy.authorizeSubmission(principal, property.getId(), command.tenantId());

        WorkerSpecialization required = specializationService.determineSpecialization(
                joinText(command.title(), command.description()), command.categoryHint());
        LocalDateTime now = now();
        TenantRequest request = property.fileRequest(command.tenantId(), command.title(), command.description(),
                command.categoryHint(), urgency, required, principal.userId(), now);
        requestRepository.add(request);
        propertyRepository.update(property);

        log.info("[EVENT → request.created] request={} property={} specialization={} urgency={}",
                request.getCode(), property.getCode(), required, urgency);
        publisher.publishEvent(new RequestCreatedEvent(request.getId(), request.getCode(), property.getId(),
                request.getTenantId(), request.getTitle(), required, urgency, principal.userId(), now));
        return request;
    }

    @Transactional(readOnly = true)
    public TenantRequest getRequest(UUID requestId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        authorizationPolicy.authorize(principalRoleLookup.resolve(userId), RequestAction.VIEW, request);
        return request;
    }

    @Transactional(readOnly = true)
    public List<TenantRequest> findRequests(Specification<TenantRequest> specification) {
        return requestRepository.find(specification);
    }

    /**
     * Requests matching the specification that the user is allowed to view.
     */
    @Transactional(readOnly = true)
    public List<TenantRequest> findVisibleRequests(Specification<TenantRequest> specification, String userId) {
        Principal principal = principalRoleLookup.resolve(userId);
        return requestRepository.find(specification).stream()
                .filter(request -> authorizationPolicy.isAllowed(principal, RequestAction.VIEW, request))
                .toList();
    }

    @Transactional(readOnly = true)
    public long countRequests(Specification<TenantRequest> specification) {
        return requestRepository.count(specification);
    }

    @Transactional(readOnly = true)
    public List<Worker> findEligibleWorkers(UUID requestId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        authorizationPolicy.authorize(principalRoleLookup.resolve(userId), RequestAction.ASSIGN, request);
        return matchingService.findEligibleWorkers(request);
    }

    @Transactional
    public TenantRequest startReview(UUID requestId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.IN_REVIEW);
        Principal principal = authorize(request, RequestAction.REVIEW, userId);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        request.startReview(principal.userId(), now);
        requestRepository.update(request);

        publishStatusChange(request, previous, null, principal, now);
        return request;
    }

    /**
     * Assigns a worker to a SUBMITTED or IN_REVIEW request.
     * Kafka analogy: producer publishes to topic "worker.assigned"
     */
    @Transactional
    public TenantRequest assignWorker(UUID requestId, UUID workerId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireAssignable();
        Principal principal = authorize(request, RequestAction.ASSIGN, userId);

        Worker worker = workerRepository.get(workerId);
        requireEligible(worker, request);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        worker.assign(request.getId(), assignmentPolicy.getMaxConcurrentAssignments());
        request.assign(worker.getId(), principal.userId(), now);
        requestRepository.update(request);
        workerRepository.update(worker);

        if (previous == TenantRequestStatus.SUBMITTED) {
            publishStatusChange(request, previous, TenantRequestStatus.IN_REVIEW, null, principal, now);
            previous = TenantRequestStatus.IN_REVIEW;
        }
        publishStatusChange(request, previous, null, principal, now);
        publishAssigned(request, worker, principal, now);
        return request;
    }

    /**
     * Hands an ASSIGNED request to another worker. The old worker is released and the new one
     * charged in the same transaction.
     */
    @Transactional
    public TenantRequest reassignWorker(UUID requestId, UUID newWorkerId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireReassignable();
        Principal principal = authorize(request, RequestAction.ASSIGN, userId);

        Worker newWorker = workerRepository.get(newWorkerId);
        requireEligible(newWorker, request);
        Worker previousWorker = workerRepository.get(request.getAssignedWorkerId());

        int cap = assignmentPolicy.getMaxConcurrentAssignments();
        LocalDateTime now = now();
        newWorker.assign(request.getId(), cap);
        previousWorker.release(request.getId(), cap);
        request.reassign(newWorker.getId(), principal.userId(), now);
        requestRepository.update(request);
        workerRepository.update(previousWorker);
        workerRepository.update(newWorker);

        publishUnassigned(request, previousWorker, "reassigned", principal, now);
        publishAssigned(request, newWorker, principal, now);
        return request;
    }

    @Transactional
    public TenantRequest startWork(UUID requestId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.IN_PROGRESS);
        Principal principal = authorize(request, RequestAction.START_WORK, userId);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        request.startWork(principal.userId(), now);
        requestRepository.update(request);

        publishStatusChange(request, previous, null, principal, now);
        return request;
    }

    /**
     * Closes the request and frees the worker's capacity.
     */
    @Transactional
    public TenantRequest completeWork(UUID requestId, String notes, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.COMPLETED);
        Principal principal = authorize(request, RequestAction.COMPLETE_WORK, userId);

        Worker worker = workerRepository.get(request.getAssignedWorkerId());
        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        request.complete(notes, principal.userId(), now);
        worker.completeAssignment(request.getId(), assignmentPolicy.getMaxConcurrentAssignments());
        requestRepository.update(request);
        workerRepository.update(worker);

        publishStatusChange(request, previous, notes, principal, now);
        return request;
    }

    @Transactional
    public TenantRequest decline(UUID requestId, String reason, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.DECLINED);
        Principal principal = authorize(request, RequestAction.DECLINE, userId);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        UUID releasedWorkerId = request.decline(reason, principal.userId(), now);
        requestRepository.update(request);
        releaseWorker(request, releasedWorkerId, "declined", principal, now);

        publishStatusChange(request, previous, request.getDeclineReason(), principal, now);
        return request;
    }

    @Transactional
    public TenantRequest escalate(UUID requestId, String reason, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.ESCALATED);
        Principal principal = authorize(request, RequestAction.ESCALATE, userId);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        UUID releasedWorkerId = request.escalate(reason, principal.userId(), now);
        requestRepository.update(request);
        releaseWorker(request, releasedWorkerId, "escalated", principal, now);

        publishStatusChange(request, previous, request.getEscalationReason(), principal, now);
        return request;
    }

    @Transactional
    public TenantRequest resolveEscalation(UUID requestId, String userId) {
        TenantRequest request = requestRepository.get(requestId);
        request.requireTransition(TenantRequestStatus.IN_REVIEW);
        Principal principal = authorize(request, RequestAction.RESOLVE_ESCALATION, userId);

        TenantRequestStatus previous = request.getStatus();
        LocalDateTime now = now();
        request.resolveEscalation(principal.userId(), now);
        requestRepository.update(request);

        publishStatusChange(request, previous, null, principal, now);
        return request;
    }

    private Principal authorize(TenantRequest request, RequestAction action, String userId) {
        Principal principal = principalRoleLookup.resolve(userId);
        authorizationPolicy.authorize(principal, action, request);
        return principal;
    }

    private void requireEligible(Worker worker, TenantRequest request) {
        boolean fallback = matchingService.isGeneralFallbackPermitted(request.getRequiredSpecialization());
        AssignmentEligibility eligibility = assignmentPolicy.canBeAssigned(worker, request, fallback);
        if (!eligibility.isEligible()) {
            log.warn("Assignment rejected: request={} worker={} reason={}",
                    request.getCode(), worker.getEmail(), eligibility.rejectionReason());
        }
        eligibility.orThrow(request.getId(), worker.getId());
    }

    private void releaseWorker(TenantRequest request, UUID workerId, String reason, Principal principal,
                               LocalDateTime now) {
        if (workerId == null) {
            return;
        }
        Worker worker = workerRepository.get(workerId);
        worker.release(request.getId(), assignmentPolicy.getMaxConcurrentAssignments());
        workerRepository.update(worker);
        publishUnassigned(request, worker, reason, principal, now);
    }

    private void publishStatusChange(TenantRequest request, TenantRequestStatus previous, String reason,
                                     Principal principal, LocalDateTime now) {
        publishStatusChange(request, previous, request.getStatus(), reason, principal, now);
    }

    private void publishStatusChange(TenantRequest request, TenantRequestStatus previous, TenantRequestStatus current,
                                     String reason, Principal principal, LocalDateTime now) {
        log.info("[EVENT → request.status-changed] request={} {} → {} by {}",
                request.getCode(), previous, current, principal.userId());
        publisher.publishEvent(new RequestStatusChangedEvent(request.getId(), request.getCode(),
                request.getPropertyId(), request.getTenantId(), previous, current,
                current.requiresAssignedWorker() ? request.getAssignedWorkerId() : null,
                reason, principal.userId(), now));
    }

    private void publishAssigned(TenantRequest request, Worker worker, Principal principal, LocalDateTime now) {
        log.info("[EVENT → worker.assigned] request={} worker={} load={} available={}",
                request.getCode(), worker.getEmail(), worker.getActiveAssignmentCount(), worker.isAvailable());
        publisher.publishEvent(new WorkerAssignedEvent(request.getId(), request.getCode(), request.getPropertyId(),
                worker.getId(), worker.getEmail(), request.getRequiredSpecialization(), worker.getSpecialization(),
                principal.userId(), now));
    }

    private void publishUnassigned(TenantRequest request, Worker worker, String reason, Principal principal,
                                   LocalDateTime now) {
        log.info("[EVENT → worker.unassigned] request={} worker={} reason={} load={}",
                request.getCode(), worker.getEmail(), reason, worker.getActiveAssignmentCount());
        publisher.publishEvent(new WorkerUnassignedEvent(request.getId(), request.getCode(), worker.getId(),
                worker.getEmail(), reason, principal.userId(), now));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String joinText(String title, String description) {
        return (title != null ? title : "") + " " + (description != null ? description : "");
    }
}
