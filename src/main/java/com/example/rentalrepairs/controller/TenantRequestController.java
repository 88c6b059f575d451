package com.example.rentalrepairs.controller;

import com.example.rentalrepairs.controller.dto.RequestDtos.AssignWorkerRequest;
import com.example.rentalrepairs.controller.dto.RequestDtos.CompleteRequest;
import com.example.rentalrepairs.controller.dto.RequestDtos.ReasonRequest;
import com.example.rentalrepairs.controller.dto.RequestDtos.RequestResponse;
import com.example.rentalrepairs.controller.dto.RequestDtos.SubmitRequest;
import com.example.rentalrepairs.controller.dto.WorkerDtos.WorkerResponse;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.service.SubmitRequestCommand;
import com.example.rentalrepairs.service.TenantRequestService;
import com.example.rentalrepairs.specification.Specification;
import com.example.rentalrepairs.specification.SortDirection;
import com.example.rentalrepairs.specification.TenantRequestSpecifications;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API over the request lifecycle.
 *
 * Typical flow:
 *   1. POST /requests                            → tenant files a request (SUBMITTED)
 *   2. POST /requests/{id}/review                → superintendent picks it up (IN_REVIEW)
 *   3. GET  /requests/{id}/eligible-workers      → matching workers, specialists first
 *   4. POST /requests/{id}/assign                → ASSIGNED
 *   5. POST /requests/{id}/start, /complete      → worker does the job (IN_PROGRESS, COMPLETED)
 *
 * The acting user is taken from the X-User-Id header.
 */
@RestController
@RequestMapping("/requests")
public class TenantRequestController {

    static final String USER_HEADER = "X-User-Id";

    private final TenantRequestService requestService;

    public TenantRequestController(TenantRequestService requestService) {
        this.requestService = requestService;
    }

    @PostMapping
    public ResponseEntity<RequestResponse> submit(@RequestHeader(USER_HEADER) String userId,
                                                  @Valid @RequestBody SubmitRequest body) {
        TenantRequest request = requestService.submitRequest(new SubmitRequestCommand(body.propertyId(),
                body.tenantId(), body.title(), body.description(), body.categoryHint(), body.urgency()), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(RequestResponse.from(request));
    }

    @GetMapping("/{requestId}")
    public RequestResponse get(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId) {
        return RequestResponse.from(requestService.getRequest(requestId, userId));
    }

    /** Requests of one property the caller may see, newest first; optionally one status only. */
    @GetMapping
    public List<RequestResponse> list(@RequestHeader(USER_HEADER) String userId,
                                      @RequestParam UUID propertyId,
                                      @RequestParam(required = false) TenantRequestStatus status) {
        Specification<TenantRequest> specification = TenantRequestSpecifications.byProperty(propertyId);
        if (status != null) {
            specification = specification.and(TenantRequestSpecifications.byStatus(status));
        }
        return requestService.findVisibleRequests(specification.orderBy("submittedAt", SortDirection.DESC), userId)
                .stream()
                .map(RequestResponse::from)
                .toList();
    }

    @GetMapping("/{requestId}/eligible-workers")
    public List<WorkerResponse> eligibleWorkers(@RequestHeader(USER_HEADER) String userId,
                                                @PathVariable UUID requestId) {
        return requestService.findEligibleWorkers(requestId, userId).stream()
                .map(WorkerResponse::from)
                .toList();
    }

    @PostMapping("/{requestId}/review")
    public RequestResponse review(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId) {
        return RequestResponse.from(requestService.startReview(requestId, userId));
    }

    @PostMapping("/{requestId}/assign")
    public RequestResponse assign(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId,
                                  @Valid @RequestBody AssignWorkerRequest body) {
        return RequestResponse.from(requestService.assignWorker(requestId, body.workerId(), userId));
    }

    @PostMapping("/{requestId}/reassign")
    public RequestResponse reassign(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId,
                                    @Valid @RequestBody AssignWorkerRequest body) {
        return RequestResponse.from(requestService.reassignWorker(requestId, body.workerId(), userId));
    }

    @PostMapping("/{requestId}/start")
    public RequestResponse start(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId) {
        return RequestResponse.from(requestService.startWork(requestId, userId));
    }

    @PostMapping("/{requestId}/complete")
    public RequestResponse complete(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId,
                                    @Valid @RequestBody(required = false) CompleteRequest body) {
        String notes = body != null ? body.notes() : null;
        return RequestResponse.from(requestService.completeWork(requestId, notes, userId));
    }

    @PostMapping("/{requestId}/decline")
    public RequestResponse decline(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId,
                                   @Valid @RequestBody ReasonRequest body) {
        return RequestResponse.from(requestService.decline(requestId, body.reason(), userId));
    }

    @PostMapping("/{requestId}/escalate")
    public RequestResponse escalate(@RequestHeader(USER_HEADER) String userId, @PathVariable UUID requestId,
                                    @Valid @RequestBody ReasonRequest body) {
        return RequestResponse.from(requestService.escalate(requestId, body.reason(), userId));
    }

    @PostMapping("/{requestId}/resolve-escalation")
    public RequestResponse resolveEscalation(@RequestHeader(USER_HEADER) String userId,
                                             @PathVariable UUID requestId) {
        return RequestResponse.from(requestService.resolveEscalation(requestId, userId));
    }
}
