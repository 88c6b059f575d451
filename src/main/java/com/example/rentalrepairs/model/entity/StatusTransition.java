package com.example.rentalrepairs.model.entity;

import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * One entry of a request's status history.
 */
@Embeddable
public class StatusTransition {

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status")
    private TenantRequestStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false)
    private TenantRequestStatus toStatus;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Column(name = "note", length = 1000)
    private String note;

    protected StatusTransition() {
    }

    StatusTransition(TenantRequestStatus fromStatus, TenantRequestStatus toStatus, String actorId,
                     LocalDateTime occurredAt, String note) {
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.actorId = actorId;
        this.occurredAt = occurredAt;
        this.note = note;
    }

    /** {@code null} for the initial submission. */
    public TenantRequestStatus getFromStatus() {
        return fromStatus;
    }

    public TenantRequestStatus getToStatus() {
        return toStatus;
    }

    public String getActorId() {
        return actorId;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }

    public String getNote() {
        return note;
    }
}
