package com.example.rentalrepairs.model.entity;

import com.example.rentalrepairs.exception.IllegalStatusTransitionException;
import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A repair request filed by a tenant. Status only changes through the transition methods, each
 * of which checks the status graph first and leaves the request untouched when the check fails.
 *
 * Invariant: {@code assignedWorkerId != null} exactly when the status is ASSIGNED, IN_PROGRESS
 * or COMPLETED.
 */
@Entity
@Table(name = "tenant_requests")
public class TenantRequest {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false)
    private String code;

    @Column(nullable = false, updatable = false)
    private UUID propertyId;

    @Column(nullable = false, updatable = false)
    private UUID tenantId;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 4000)
    private String description;

    private String categoryHint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private WorkerSpecialization requiredSpecialization;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TenantRequestUrgency urgency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TenantRequestStatus status;

    private UUID assignedWorkerId;

    private LocalDateTime submittedAt;
    private LocalDateTime dueAt;
    private LocalDateTime reviewedAt;
    private LocalDateTime assignedAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime declinedAt;
    private LocalDateTime escalatedAt;
    private LocalDateTime updatedAt;

    @Column(length = 1000)
    private String declineReason;

    @Column(length = 1000)
    private String escalationReason;

    @Column(length = 2000)
    private String completionNotes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tenant_request_history", joinColumns = @JoinColumn(name = "request_id"))
    @OrderColumn(name = "position")
    private List<StatusTransition> history = new ArrayList<>();

    @Version
    private Long version;

    protected TenantRequest() {
    }

    TenantRequest(UUID propertyId, String code, UUID tenantId, String title, String description,
                  String categoryHint, WorkerSpecialization requiredSpecialization,
                  TenantRequestUrgency urgency, String actorId, LocalDateTime now) {
        this.id = UUID.randomUUID();
        this.propertyId = propertyId;
        this.code = code;
        this.tenantId = tenantId;
        this.title = Guard.requireText("title", title, 200);
        this.description = Guard.requireText("description", description, 4000);
        this.categoryHint = categoryHint == null || categoryHint.isBlank() ? null : categoryHint.trim();
        this.requiredSpecialization = Guard.requireNonNull("requiredSpecialization", requiredSpecialization);
        this.urgency = urgency != null ? urgency : TenantRequestUrgency.NORMAL;
        this.status = TenantRequestStatus.SUBMITTED;
        this.submittedAt = now;
        this.dueAt = now.plusHours(this.urgency.getExpectedResolutionHours());
        this.updatedAt = now;
        history.add(new StatusTransition(null, TenantRequestStatus.SUBMITTED, actorId, now, null));
    }

    // --- Lifecycle transition methods ---

    public void startReview(String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.IN_REVIEW);
        this.reviewedAt = now;
        moveTo(TenantRequestStatus.IN_REVIEW, actorId, now, null);
    }

    /**
     * Assigns a worker. A SUBMITTED request is first moved through IN_REVIEW so the review step
     * is never skipped in the history.
     */
    public void assign(UUID workerId, String actorId, LocalDateTime now) {
        requireAssignable();
        if (status == TenantRequestStatus.SUBMITTED) {
            startReview(actorId, now);
        }
        this.assignedWorkerId = workerId;
        this.assignedAt = now;
        moveTo(TenantRequestStatus.ASSIGNED, actorId, now, "worker " + workerId);
    }

    /**
     * Swaps the assigned worker while staying ASSIGNED.
     *
     * @return the worker that was replaced
     */
    public UUID reassign(UUID workerId, String actorId, LocalDateTime now) {
        requireReassignable();
        UUID previous = assignedWorkerId;
        this.assignedWorkerId = workerId;
        this.assignedAt = now;
        this.updatedAt = now;
        history.add(new StatusTransition(status, status, actorId, now,
                "reassigned from worker " + previous + " to worker " + workerId));
        return previous;
    }

    public void startWork(String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.IN_PROGRESS);
        this.startedAt = now;
        moveTo(TenantRequestStatus.IN_PROGRESS, actorId, now, null);
    }

    public void complete(String notes, String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.COMPLETED);
        this.completedAt = now;
        this.completionNotes = notes;
        moveTo(TenantRequestStatus.COMPLETED, actorId, now, notes);
    }

    /**
     * @return the worker released by the decline, or {@code null} if none was assigned
     */
    public UUID decline(String reason, String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.DECLINED);
        String text = Guard.requireText("reason", reason, 1000);
        UUID released = assignedWorkerId;
        this.assignedWorkerId = null;
        this.declinedAt = now;
        this.declineReason = text;
        moveTo(TenantRequestStatus.DECLINED, actorId, now, text);
        return released;
    }

    /**
     * @return the worker released by the escalation, or {@code null} if none was assigned
     */
    public UUID escalate(String reason, String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.ESCALATED);
        String text = Guard.requireText("reason", reason, 1000);
        UUID released = assignedWorkerId;
        this.assignedWorkerId = null;
        this.escalatedAt = now;
        this.escalationReason = text;
        moveTo(TenantRequestStatus.ESCALATED, actorId, now, text);
        return released;
    }

    public void resolveEscalation(String actorId, LocalDateTime now) {
        requireTransition(TenantRequestStatus.IN_REVIEW);
        this.reviewedAt = now;
        moveTo(TenantRequestStatus.IN_REVIEW, actorId, now, "escalation resolved");
    }

    // --- Guards, callable before touching any other aggregate ---

    public void requireTransition(TenantRequestStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStatusTransitionException(id, status, target);
        }
    }

    public void requireAssignable() {
        if (status != TenantRequestStatus.SUBMITTED) {
            requireTransition(TenantRequestStatus.ASSIGNED);
        }
    }

    public void requireReassignable() {
        if (status != TenantRequestStatus.ASSIGNED) {
            throw new InvariantViolationException(
                    status.isTerminal() ? InvariantRule.TERMINAL_REQUEST_IMMUTABLE : InvariantRule.STATUS_TRANSITION,
                    "TenantRequest", id, "Only ASSIGNED requests can be reassigned, request " + id + " is " + status);
        }
    }

    public boolean isAssignmentConsistent() {
        return status.requiresAssignedWorker() == (assignedWorkerId != null);
    }

    public boolean isOverdue(LocalDateTime now) {
        return !status.isTerminal() && dueAt.isBefore(now);
    }

    private void moveTo(TenantRequestStatus target, String actorId, LocalDateTime now, String note) {
        history.add(new StatusTransition(status, target, actorId, now, note));
        this.status = target;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public UUID getPropertyId() {
        return propertyId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getCategoryHint() {
        return categoryHint;
    }

    public WorkerSpecialization getRequiredSpecialization() {
        return requiredSpecialization;
    }

    public TenantRequestUrgency getUrgency() {
        return urgency;
    }

    public TenantRequestStatus getStatus() {
        return status;
    }

    public UUID getAssignedWorkerId() {
        return assignedWorkerId;
    }

    public LocalDateTime getSubmittedAt() {
        return submittedAt;
    }

    public LocalDateTime getDueAt() {
        return dueAt;
    }

    public LocalDateTime getReviewedAt() {
        return reviewedAt;
    }

    public LocalDateTime getAssignedAt() {
        return assignedAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public LocalDateTime getDeclinedAt() {
        return declinedAt;
    }

    public LocalDateTime getEscalatedAt() {
        return escalatedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public String getDeclineReason() {
        return declineReason;
    }

    public String getEscalationReason() {
        return escalationReason;
    }

    public String getCompletionNotes() {
        return completionNotes;
    }

    public List<StatusTransition> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Long getVersion() {
        return version;
    }
}
