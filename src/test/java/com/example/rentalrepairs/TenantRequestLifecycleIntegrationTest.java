package com.example.rentalrepairs;

import com.example.rentalrepairs.exception.ConcurrencyConflictException;
import com.example.rentalrepairs.exception.IllegalStatusTransitionException;
import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.exception.WorkerAssignmentException;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.StatusTransition;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.service.PropertyService;
import com.example.rentalrepairs.service.RegisterPropertyCommand;
import com.example.rentalrepairs.service.RegisterWorkerCommand;
import com.example.rentalrepairs.service.SubmitRequestCommand;
import com.example.rentalrepairs.service.TenantRequestService;
import com.example.rentalrepairs.service.WorkerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class TenantRequestLifecycleIntegrationTest {

    @Autowired private PropertyService propertyService;
    @Autowired private WorkerService workerService;
    @Autowired private TenantRequestService requestService;
    @Autowired private TenantRequestRepository requestRepository;
    @Autowired private WorkerRepository workerRepository;

    private String superintendent;
    private Property property;
    private Tenant tenant;
    private Worker plumber;
    private Worker electrician;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        superintendent = "super-" + suffix + "@elm.example";
        property = propertyService.registerProperty(new RegisterPropertyCommand("P" + suffix, "Elm Court",
                "12 Elm Street", "Springfield", "11111", superintendent, List.of("1A", "1B")));
        tenant = propertyService.registerTenant(property.getId(), "ann-" + suffix + "@elm.example", "Ann Tenant", "1A");
        plumber = workerService.registerWorker(
                new RegisterWorkerCommand("pat-" + suffix + "@crew.example", "Pat Plumber", "plumbing"));
        electrician = workerService.registerWorker(
                new RegisterWorkerCommand("eli-" + suffix + "@crew.example", "Eli Sparks", "Electrical"));
    }

    @Test
    void leakingTap_isRoutedToPlumberAndCompleted() {
        TenantRequest request = submit("Leaking kitchen tap");
        assertThat(request.getRequiredSpecialization()).isEqualTo(WorkerSpecialization.PLUMBING);
        assertThat(request.getCode()).isEqualTo(property.getCode() + "-1");

        requestService.startReview(request.getId(), superintendent);
        assertThat(requestService.findEligibleWorkers(request.getId(), superintendent))
                .extracting(Worker::getId)
                .contains(plumber.getId())
                .doesNotContain(electrician.getId());

        requestService.assignWorker(request.getId(), plumber.getId(), superintendent);
        assertThat(workerRepository.get(plumber.getId()).getActiveAssignmentCount()).isEqualTo(1);

        requestService.startWork(request.getId(), plumber.getEmail());
        requestService.completeWork(request.getId(), "Replaced washer", plumber.getEmail());

        TenantRequest completed = requestRepository.get(request.getId());
        assertThat(completed.getStatus()).isEqualTo(TenantRequestStatus.COMPLETED);
        assertThat(completed.getAssignedWorkerId()).isEqualTo(plumber.getId());
        assertThat(completed.getHistory())
                .extracting(StatusTransition::getToStatus)
                .containsExactly(TenantRequestStatus.SUBMITTED, TenantRequestStatus.IN_REVIEW,
                        TenantRequestStatus.ASSIGNED, TenantRequestStatus.IN_PROGRESS, TenantRequestStatus.COMPLETED);

        Worker released = workerRepository.get(plumber.getId());
        assertThat(released.getActiveAssignmentCount()).isZero();
        assertThat(released.getCompletedAssignmentCount()).isEqualTo(1);

        assertThatThrownBy(() -> requestService.escalate(request.getId(), "again", superintendent))
                .isInstanceOf(IllegalStatusTransitionException.class)
                .extracting("rule").isEqualTo(InvariantRule.TERMINAL_REQUEST_IMMUTABLE);
        assertThatThrownBy(() -> requestService.decline(request.getId(), "again", superintendent))
                .isInstanceOf(IllegalStatusTransitionException.class);
    }

    @Test
    void electrician_isRejectedForPlumbingWithoutAnyChange() {
        TenantRequest request = submit("Leaking kitchen tap");
        requestService.startReview(request.getId(), superintendent);

        assertThatThrownBy(() -> requestService.assignWorker(request.getId(), electrician.getId(), superintendent))
                .isInstanceOf(WorkerAssignmentException.class)
                .extracting("reason").isEqualTo(AssignmentRejectionReason.SPECIALIZATION_MISMATCH);

        TenantRequest unchanged = requestRepository.get(request.getId());
        assertThat(unchanged.getStatus()).isEqualTo(TenantRequestStatus.IN_REVIEW);
        assertThat(unchanged.getAssignedWorkerId()).isNull();
        assertThat(workerRepository.get(electrician.getId()).getActiveAssignmentCount()).isZero();
    }

    @Test
    void declineAfterAssignment_releasesWorker() {
        TenantRequest request = submit("Leaking kitchen tap");
        requestService.assignWorker(request.getId(), plumber.getId(), superintendent);

        requestService.decline(request.getId(), "Tenant fixed it", superintendent);

        TenantRequest declined = requestRepository.get(request.getId());
        assertThat(declined.getStatus()).isEqualTo(TenantRequestStatus.DECLINED);
        assertThat(declined.getAssignedWorkerId()).isNull();
        assertThat(declined.getDeclineReason()).isEqualTo("Tenant fixed it");
        Worker worker = workerRepository.get(plumber.getId());
        assertThat(worker.getActiveAssignmentCount()).isZero();
        assertThat(worker.isAvailable()).isTrue();
    }

    @Test
    void fourthAssignment_exceedsCapacity() {
        for (int i = 0; i < 3; i++) {
            TenantRequest request = submit("Dripping pipe " + i);
            requestService.assignWorker(request.getId(), plumber.getId(), superintendent);
        }
        TenantRequest fourth = submit("Clogged drain");

        assertThatThrownBy(() -> requestService.assignWorker(fourth.getId(), plumber.getId(), superintendent))
                .isInstanceOf(WorkerAssignmentException.class)
                .extracting("reason").isEqualTo(AssignmentRejectionReason.WORKER_AT_CAPACITY);

        Worker worker = workerRepository.get(plumber.getId());
        assertThat(worker.getActiveAssignmentCount()).isEqualTo(3);
        assertThat(worker.isAvailable()).isFalse();
        assertThat(requestRepository.get(fourth.getId()).getStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
    }

    @Test
    void escalation_releasesWorkerAndResolutionReturnsToReview() {
        TenantRequest request = submit("Leaking kitchen tap");
        requestService.assignWorker(request.getId(), plumber.getId(), superintendent);
        requestService.startWork(request.getId(), plumber.getEmail());

        requestService.escalate(request.getId(), "Needs a licensed contractor", superintendent);
        assertThat(workerRepository.get(plumber.getId()).getActiveAssignmentCount()).isZero();

        requestService.resolveEscalation(request.getId(), superintendent);
        TenantRequest resolved = requestRepository.get(request.getId());
        assertThat(resolved.getStatus()).isEqualTo(TenantRequestStatus.IN_REVIEW);
        assertThat(resolved.isAssignmentConsistent()).isTrue();
    }

    @Test
    void changeSpecialization_refusedWhileAssignmentNeedsOldTrade() {
        TenantRequest request = submit("Leaking kitchen tap");
        requestService.assignWorker(request.getId(), plumber.getId(), superintendent);

        assertThatThrownBy(() -> workerService.changeSpecialization(plumber.getId(), "electrical", "system"))
                .isInstanceOf(InvariantViolationException.class)
                .extracting("rule").isEqualTo(InvariantRule.SPECIALIZATION_CHANGE_CONFLICT);

        requestService.decline(request.getId(), "Duplicate", superintendent);
        Worker changed = workerService.changeSpecialization(plumber.getId(), "electrical", "system");
        assertThat(changed.getSpecialization()).isEqualTo(WorkerSpecialization.ELECTRICAL);
        assertThat(changed.getSpecializationChangedBy()).isEqualTo("system");
    }

    @Test
    void staleWorkerUpdate_isAConcurrencyConflict() {
        Worker first = workerRepository.get(plumber.getId());
        Worker stale = workerRepository.get(plumber.getId());

        first.deactivate(3);
        workerRepository.update(first);
        stale.changeSpecialization(WorkerSpecialization.HVAC, List.of(), "system", TestFixtures.NOW);

        assertThatThrownBy(() -> workerRepository.update(stale))
                .isInstanceOf(ConcurrencyConflictException.class);
        Worker stored = workerRepository.get(plumber.getId());
        assertThat(stored.isActive()).isFalse();
        assertThat(stored.getSpecialization()).isEqualTo(WorkerSpecialization.PLUMBING);
    }

    private TenantRequest submit(String title) {
        return requestService.submitRequest(new SubmitRequestCommand(property.getId(), tenant.getId(), title,
                title + ", please send someone", null, "normal"), tenant.getEmail());
    }
}
