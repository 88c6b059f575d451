package com.example.rentalrepairs.service;

import com.example.rentalrepairs.TestFixtures;
import com.example.rentalrepairs.events.RequestCreatedEvent;
import com.example.rentalrepairs.events.RequestStatusChangedEvent;
import com.example.rentalrepairs.events.WorkerAssignedEvent;
import com.example.rentalrepairs.events.WorkerUnassignedEvent;
import com.example.rentalrepairs.exception.AuthorizationException;
import com.example.rentalrepairs.exception.IllegalStatusTransitionException;
import com.example.rentalrepairs.exception.WorkerAssignmentException;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.AssignmentRejectionReason;
import com.example.rentalrepairs.model.enums.GeneralFallbackPolicy;
import com.example.rentalrepairs.model.enums.PrincipalRole;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import com.example.rentalrepairs.repository.PropertyRepository;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.security.Principal;
import com.example.rentalrepairs.security.PrincipalRoleLookup;
import com.example.rentalrepairs.security.RequestAuthorizationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.example.rentalrepairs.TestFixtures.CAP;
import static com.example.rentalrepairs.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantRequestServiceTest {

    @Mock private TenantRequestRepository requestRepository;
    @Mock private PropertyRepository propertyRepository;
    @Mock private WorkerRepository workerRepository;
    @Mock private WorkerMatchingService matchingService;
    @Mock private PrincipalRoleLookup principalRoleLookup;
    @Mock private ApplicationEventPublisher publisher;

    private TenantRequestService service;

    private Property property;
    private Tenant tenant;
    private TenantRequest request;
    private Worker plumber;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZoneId.systemDefault()).toInstant(), ZoneId.systemDefault());
        service = new TenantRequestService(requestRepository, propertyRepository, workerRepository,
                new SpecializationDeterminationService(),
                new WorkerAssignmentPolicy(TestFixtures.properties(CAP, GeneralFallbackPolicy.WHEN_NO_SPECIALIST_AVAILABLE)),
                matchingService, principalRoleLookup, new RequestAuthorizationPolicy(), publisher, clock);

        property = TestFixtures.property();
        tenant = TestFixtures.tenant(property);
        request = TestFixtures.request(property, tenant, WorkerSpecialization.PLUMBING);
        plumber = TestFixtures.worker("pat@crew.example", WorkerSpecialization.PLUMBING);
    }

    @Test
    void submitRequest_determinesSpecializationAndPublishesCreated() {
        when(propertyRepository.get(property.getId())).thenReturn(property);
        when(principalRoleLookup.resolve(TestFixtures.TENANT_EMAIL)).thenReturn(tenantPrincipal());

        TenantRequest created = service.submitRequest(new SubmitRequestCommand(property.getId(), tenant.getId(),
                "Leaking kitchen tap", "Water everywhere", null, "high"), TestFixtures.TENANT_EMAIL);

        assertThat(created.getRequiredSpecialization()).isEqualTo(WorkerSpecialization.PLUMBING);
        assertThat(created.getStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
        assertThat(created.getSubmittedAt()).isEqualTo(NOW);
        assertThat(created.getDueAt()).isEqualTo(NOW.plusHours(24));
        verify(requestRepository).add(created);
        verify(propertyRepository).update(property);

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(events.capture());
        assertThat(events.getValue()).isInstanceOfSatisfying(RequestCreatedEvent.class, event -> {
            assertThat(event.requestId()).isEqualTo(created.getId());
            assertThat(event.requiredSpecialization()).isEqualTo(WorkerSpecialization.PLUMBING);
        });
    }

    @Test
    void submitRequest_byNonTenant_isForbiddenAndPersistsNothing() {
        when(propertyRepository.get(property.getId())).thenReturn(property);
        when(principalRoleLookup.resolve("mallory@example.com")).thenReturn(Principal.anonymous("mallory@example.com"));

        assertThatThrownBy(() -> service.submitRequest(new SubmitRequestCommand(property.getId(), tenant.getId(),
                "Leak", "Leak", null, null), "mallory@example.com"))
                .isInstanceOf(AuthorizationException.class);

        verify(requestRepository, never()).add(any());
        verify(propertyRepository, never()).update(any());
        verifyNoInteractions(publisher);
    }

    @Test
    void assignWorker_fromSubmitted_publishesReviewThenAssignment() {
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve(TestFixtures.SUPERINTENDENT)).thenReturn(superintendentPrincipal());
        when(workerRepository.get(plumber.getId())).thenReturn(plumber);
        when(matchingService.isGeneralFallbackPermitted(WorkerSpecialization.PLUMBING)).thenReturn(false);

        service.assignWorker(request.getId(), plumber.getId(), TestFixtures.SUPERINTENDENT);

        assertThat(request.getStatus()).isEqualTo(TenantRequestStatus.ASSIGNED);
        assertThat(request.getAssignedWorkerId()).isEqualTo(plumber.getId());
        assertThat(plumber.isAssignedTo(request.getId())).isTrue();
        verify(requestRepository).update(request);
        verify(workerRepository).update(plumber);

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(3)).publishEvent(events.capture());
        List<Object> published = events.getAllValues();
        assertThat(published.get(0)).isInstanceOfSatisfying(RequestStatusChangedEvent.class, event -> {
            assertThat(event.previousStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
            assertThat(event.newStatus()).isEqualTo(TenantRequestStatus.IN_REVIEW);
        });
        assertThat(published.get(1)).isInstanceOfSatisfying(RequestStatusChangedEvent.class, event -> {
            assertThat(event.previousStatus()).isEqualTo(TenantRequestStatus.IN_REVIEW);
            assertThat(event.newStatus()).isEqualTo(TenantRequestStatus.ASSIGNED);
            assertThat(event.assignedWorkerId()).isEqualTo(plumber.getId());
        });
        assertThat(published.get(2)).isInstanceOf(WorkerAssignedEvent.class);
    }

    @Test
    void assignWorker_withMismatchedSpecialization_changesNothing() {
        Worker electrician = TestFixtures.worker("eli@crew.example", WorkerSpecialization.ELECTRICAL);
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve(TestFixtures.SUPERINTENDENT)).thenReturn(superintendentPrincipal());
        when(workerRepository.get(electrician.getId())).thenReturn(electrician);
        when(matchingService.isGeneralFallbackPermitted(WorkerSpecialization.PLUMBING)).thenReturn(false);

        assertThatThrownBy(() -> service.assignWorker(request.getId(), electrician.getId(), TestFixtures.SUPERINTENDENT))
                .isInstanceOf(WorkerAssignmentException.class)
                .extracting("reason").isEqualTo(AssignmentRejectionReason.SPECIALIZATION_MISMATCH);

        assertThat(request.getStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
        assertThat(request.getHistory()).hasSize(1);
        assertThat(electrician.getActiveAssignmentCount()).isZero();
        verify(requestRepository, never()).update(any());
        verify(workerRepository, never()).update(any());
        verifyNoInteractions(publisher);
    }

    @Test
    void assignWorker_byTenant_isRejectedBeforeWorkerIsLoaded() {
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve(TestFixtures.TENANT_EMAIL)).thenReturn(tenantPrincipal());

        assertThatThrownBy(() -> service.assignWorker(request.getId(), plumber.getId(), TestFixtures.TENANT_EMAIL))
                .isInstanceOf(AuthorizationException.class);

        verifyNoInteractions(workerRepository);
        assertThat(request.getStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
    }

    @Test
    void startWork_onSubmittedRequest_failsGraphCheckBeforeAuthorization() {
        when(requestRepository.get(request.getId())).thenReturn(request);

        assertThatThrownBy(() -> service.startWork(request.getId(), "pat@crew.example"))
                .isInstanceOf(IllegalStatusTransitionException.class);

        verifyNoInteractions(principalRoleLookup);
        verify(requestRepository, never()).update(any());
    }

    @Test
    void decline_assignedRequest_releasesWorker() {
        request.assign(plumber.getId(), TestFixtures.SUPERINTENDENT, NOW);
        plumber.assign(request.getId(), CAP);
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve(TestFixtures.SUPERINTENDENT)).thenReturn(superintendentPrincipal());
        when(workerRepository.get(plumber.getId())).thenReturn(plumber);

        service.decline(request.getId(), "Tenant fixed it", TestFixtures.SUPERINTENDENT);

        assertThat(request.getStatus()).isEqualTo(TenantRequestStatus.DECLINED);
        assertThat(request.getAssignedWorkerId()).isNull();
        assertThat(plumber.getActiveAssignmentCount()).isZero();
        verify(workerRepository).update(plumber);

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(2)).publishEvent(events.capture());
        assertThat(events.getAllValues()).hasAtLeastOneElementOfType(WorkerUnassignedEvent.class);
        assertThat(events.getAllValues()).hasAtLeastOneElementOfType(RequestStatusChangedEvent.class);
    }

    @Test
    void completeWork_byAssignedWorker_freesCapacity() {
        request.assign(plumber.getId(), TestFixtures.SUPERINTENDENT, NOW);
        request.startWork("pat@crew.example", NOW);
        plumber.assign(request.getId(), CAP);
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve("pat@crew.example")).thenReturn(workerPrincipal());
        when(workerRepository.get(plumber.getId())).thenReturn(plumber);

        service.completeWork(request.getId(), "Replaced washer", "pat@crew.example");

        assertThat(request.getStatus()).isEqualTo(TenantRequestStatus.COMPLETED);
        assertThat(request.getAssignedWorkerId()).isEqualTo(plumber.getId());
        assertThat(plumber.getActiveAssignmentCount()).isZero();
        assertThat(plumber.getCompletedAssignmentCount()).isEqualTo(1);
    }

    @Test
    void reassignWorker_movesCapacityBetweenWorkers() {
        Worker second = TestFixtures.worker("pia@crew.example", WorkerSpecialization.PLUMBING);
        request.assign(plumber.getId(), TestFixtures.SUPERINTENDENT, NOW);
        plumber.assign(request.getId(), CAP);
        when(requestRepository.get(request.getId())).thenReturn(request);
        when(principalRoleLookup.resolve(TestFixtures.SUPERINTENDENT)).thenReturn(superintendentPrincipal());
        when(workerRepository.get(second.getId())).thenReturn(second);
        when(workerRepository.get(plumber.getId())).thenReturn(plumber);
        when(matchingService.isGeneralFallbackPermitted(WorkerSpecialization.PLUMBING)).thenReturn(false);

        service.reassignWorker(request.getId(), second.getId(), TestFixtures.SUPERINTENDENT);

        assertThat(request.getAssignedWorkerId()).isEqualTo(second.getId());
        assertThat(plumber.getActiveAssignmentCount()).isZero();
        assertThat(second.isAssignedTo(request.getId())).isTrue();
        verify(workerRepository).update(plumber);
        verify(workerRepository).update(second);
    }

    private Principal tenantPrincipal() {
        return new Principal(TestFixtures.TENANT_EMAIL, Set.of(PrincipalRole.TENANT), Set.of(tenant.getId()), null, Set.of());
    }

    private Principal superintendentPrincipal() {
        return new Principal(TestFixtures.SUPERINTENDENT, Set.of(PrincipalRole.SUPERINTENDENT), Set.of(), null,
                Set.of(property.getId()));
    }

    private Principal workerPrincipal() {
        return new Principal("pat@crew.example", Set.of(PrincipalRole.WORKER), Set.of(), plumber.getId(), Set.of());
    }
}
