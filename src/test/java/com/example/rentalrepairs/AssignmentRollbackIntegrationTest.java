package com.example.rentalrepairs;

import com.example.rentalrepairs.exception.ConcurrencyConflictException;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.TenantRequestStatus;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.repository.jpa.JpaWorkerRepository;
import com.example.rentalrepairs.service.PropertyService;
import com.example.rentalrepairs.service.RegisterPropertyCommand;
import com.example.rentalrepairs.service.RegisterWorkerCommand;
import com.example.rentalrepairs.service.SubmitRequestCommand;
import com.example.rentalrepairs.service.TenantRequestService;
import com.example.rentalrepairs.service.WorkerService;
import com.example.rentalrepairs.specification.Specification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * A failure writing the worker after the request was already written must undo both.
 */
@SpringBootTest
class AssignmentRollbackIntegrationTest {

    @Autowired private PropertyService propertyService;
    @Autowired private WorkerService workerService;
    @Autowired private TenantRequestService requestService;
    @Autowired private TenantRequestRepository requestRepository;
    @Autowired private FailingWorkerRepository workerRepository;

    @AfterEach
    void tearDown() {
        workerRepository.failUpdates = false;
    }

    @Test
    void workerWriteFailure_rollsBackRequestChange() {
        String superintendent = "super-rb@elm.example";
        Property property = propertyService.registerProperty(new RegisterPropertyCommand("RB", "Birch House",
                "1 Birch Lane", "Springfield", "33333", superintendent, List.of("1")));
        Tenant tenant = propertyService.registerTenant(property.getId(), "cy@birch.example", "Cy", "1");
        Worker plumber = workerService.registerWorker(new RegisterWorkerCommand("pat-rb@crew.example", "Pat", "plumbing"));
        TenantRequest request = requestService.submitRequest(new SubmitRequestCommand(property.getId(), tenant.getId(),
                "Leaking tap", "Leaking tap", null, null), tenant.getEmail());

        workerRepository.failUpdates = true;
        assertThatThrownBy(() -> requestService.assignWorker(request.getId(), plumber.getId(), superintendent))
                .isInstanceOf(ConcurrencyConflictException.class);

        TenantRequest stored = requestRepository.get(request.getId());
        assertThat(stored.getStatus()).isEqualTo(TenantRequestStatus.SUBMITTED);
        assertThat(stored.getAssignedWorkerId()).isNull();
        assertThat(stored.getHistory()).hasSize(1);
        assertThat(workerRepository.get(plumber.getId()).getActiveAssignmentCount()).isZero();
    }

    static class FailingWorkerRepository implements WorkerRepository {

        private final WorkerRepository delegate;
        volatile boolean failUpdates;

        FailingWorkerRepository(WorkerRepository delegate) {
            this.delegate = delegate;
        }

        @Override
        public Worker get(UUID id) {
            return delegate.get(id);
        }

        @Override
        public Optional<Worker> findById(UUID id) {
            return delegate.findById(id);
        }

        @Override
        public Worker add(Worker aggregate) {
            return delegate.add(aggregate);
        }

        @Override
        public Worker update(Worker aggregate) {
            if (failUpdates) {
                throw new ConcurrencyConflictException("Worker", aggregate.getId(), null);
            }
            return delegate.update(aggregate);
        }

        @Override
        public List<Worker> find(Specification<Worker> specification) {
            return delegate.find(specification);
        }

        @Override
        public long count(Specification<Worker> specification) {
            return delegate.count(specification);
        }
    }

    @TestConfiguration
    static class FailingWorkerRepositoryConfig {

        @Bean
        @Primary
        FailingWorkerRepository failingWorkerRepository(JpaWorkerRepository jpaWorkerRepository) {
            return new FailingWorkerRepository(jpaWorkerRepository);
        }
    }
}
