package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.repository.TenantRequestRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Repository;

@Repository
public class JpaTenantRequestRepository extends JpaAggregateRepository<TenantRequest, TenantRequestJpaRepository>
        implements TenantRequestRepository {

    public JpaTenantRequestRepository(TenantRequestJpaRepository jpaRepository, EntityManager entityManager) {
        super(TenantRequest.class, TenantRequest::getId, jpaRepository, entityManager);
    }
}
