package com.example.rentalrepairs.model.entity;

import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.exception.WorkerAssignmentException;
import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Worker aggregate: one specialization, the requests currently assigned to it, and an
 * availability flag that is recomputed whenever either the assignments or the active flag
 * change.
 */
@Entity
@Table(name = "workers")
public class Worker {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkerSpecialization specialization;

    private boolean active;

    private boolean available;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "worker_assignments", joinColumns = @JoinColumn(name = "worker_id"))
    @Column(name = "request_id", nullable = false)
    @OrderColumn(name = "position")
    private List<UUID> assignedRequestIds = new ArrayList<>();

    // mirrors assignedRequestIds.size() so capacity can be queried as a plain column
    private int activeAssignmentCount;

    private int completedAssignmentCount;

    private LocalDateTime registeredAt;
    private LocalDateTime specializationChangedAt;
    private String specializationChangedBy;

    @Version
    private Long version;

    protected Worker() {
    }

    public Worker(String email, String fullName, WorkerSpecialization specialization, int maxConcurrentAssignments,
                  LocalDateTime registeredAt) {
        this.id = UUID.randomUUID();
        this.email = Guard.requireEmail("email", email);
        this.fullName = Guard.requireText("fullName", fullName, 200);
        this.specialization = Guard.requireNonNull("specialization", specialization);
        this.active = true;
        this.registeredAt = registeredAt;
        recomputeAvailability(maxConcurrentAssignments);
    }

    /**
     * Records an assignment. Eligibility is decided by the assignment policy beforehand; this
     * only refuses what would corrupt the aggregate itself.
     */
    public void assign(UUID requestId, int maxConcurrentAssignments) {
        if (assignedRequestIds.contains(requestId)) {
            throw new WorkerAssignmentException(requestId, id, AssignmentRejectionReason.ALREADY_ASSIGNED);
        }
        if (!active) {
            throw new WorkerAssignmentException(requestId, id, AssignmentRejectionReason.WORKER_INACTIVE);
        }
        if (assignedRequestIds.size() >= maxConcurrentAssignments) {
            throw new WorkerAssignmentException(requestId, id, AssignmentRejectionReason.WORKER_AT_CAPACITY);
        }
        assignedRequestIds.add(requestId);
        recomputeAvailability(maxConcurrentAssignments);
    }

    /**
     * Drops a request from the active assignments, e.g. after decline, escalation or reassignment.
     *
     * @return whether the request was assigned to this worker
     */
    public boolean release(UUID requestId, int maxConcurrentAssignments) {
        boolean removed = assignedRequestIds.remove(requestId);
        recomputeAvailability(maxConcurrentAssignments);
        return removed;
    }

    /** Releases a request because its work was finished. */
    public void completeAssignment(UUID requestId, int maxConcurrentAssignments) {
        if (release(requestId, maxConcurrentAssignments)) {
            completedAssignmentCount++;
        }
    }

    /**
     * Audited specialization change. Refused while an active assignment needs a trade the new
     * specialization cannot cover.
     *
     * @param activeRequirements required specializations of the currently assigned requests
     */
    public void changeSpecialization(WorkerSpecialization newSpecialization, List<WorkerSpecialization> activeRequirements,
                                     String actorId, LocalDateTime now) {
        Guard.requireNonNull("specialization", newSpecialization);
        for (WorkerSpecialization required : activeRequirements) {
            if (!newSpecialization.canHandle(required)) {
                throw new InvariantViolationException(InvariantRule.SPECIALIZATION_CHANGE_CONFLICT, "Worker", id,
                        "Worker " + email + " has an active " + required + " assignment that "
                                + newSpecialization + " cannot cover");
            }
        }
        this.specialization = newSpecialization;
        this.specializationChangedAt = now;
        this.specializationChangedBy = actorId;
    }

    public void activate(int maxConcurrentAssignments) {
        this.active = true;
        recomputeAvailability(maxConcurrentAssignments);
    }

    /** Stops new assignments; work already assigned stays with the worker. */
    public void deactivate(int maxConcurrentAssignments) {
        this.active = false;
        recomputeAvailability(maxConcurrentAssignments);
    }

    public void recomputeAvailability(int maxConcurrentAssignments) {
        this.activeAssignmentCount = assignedRequestIds.size();
        this.available = active && activeAssignmentCount < maxConcurrentAssignments;
    }

    public boolean isAssignedTo(UUID requestId) {
        return assignedRequestIds.contains(requestId);
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getFullName() {
        return fullName;
    }

    public WorkerSpecialization getSpecialization() {
        return specialization;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isAvailable() {
        return available;
    }

    public List<UUID> getAssignedRequestIds() {
        return Collections.unmodifiableList(assignedRequestIds);
    }

    public int getActiveAssignmentCount() {
        return activeAssignmentCount;
    }

    public int getCompletedAssignmentCount() {
        return completedAssignmentCount;
    }

    public LocalDateTime getRegisteredAt() {
        return registeredAt;
    }

    public LocalDateTime getSpecializationChangedAt() {
        return specializationChangedAt;
    }

    public String getSpecializationChangedBy() {
        return specializationChangedBy;
    }

    public Long getVersion() {
        return version;
    }
}
