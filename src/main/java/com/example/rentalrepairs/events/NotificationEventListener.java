package com.example.rentalrepairs.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hand-off point for notification delivery. Runs after commit only, so work that rolled back
 * never reaches tenants or workers. Delivery itself (email, SMS, push) lives outside this service;
 * the consumer side here records what would be sent.
 */
@Component
public class NotificationEventListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationEventListener.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRequestCreated(RequestCreatedEvent event) {
        log.info("[CONSUMER ← request.created] notify superintendent: request={} property={} specialization={} urgency={}",
                event.requestCode(), event.propertyId(), event.requiredSpecialization(), event.urgency());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRequestStatusChanged(RequestStatusChangedEvent event) {
        log.info("[CONSUMER ← request.status-changed] notify tenant={}: request={} {} → {}",
                event.tenantId(), event.requestCode(), event.previousStatus(), event.newStatus());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWorkerAssigned(WorkerAssignedEvent event) {
        log.info("[CONSUMER ← worker.assigned] notify worker={}: request={} needs {}",
                event.workerEmail(), event.requestCode(), event.requiredSpecialization());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWorkerUnassigned(WorkerUnassignedEvent event) {
        log.info("[CONSUMER ← worker.unassigned] notify worker={}: request={} withdrawn ({})",
                event.workerEmail(), event.requestCode(), event.reason());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWorkerSpecializationChanged(WorkerSpecializationChangedEvent event) {
        log.info("[CONSUMER ← worker.specialization-changed] worker={} {} → {} by {}",
                event.workerEmail(), event.previousSpecialization(), event.newSpecialization(), event.actorId());
    }
}
