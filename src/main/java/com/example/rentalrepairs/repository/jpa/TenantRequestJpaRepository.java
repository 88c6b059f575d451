package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.TenantRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.UUID;

public interface TenantRequestJpaRepository extends JpaRepository<TenantRequest, UUID>, JpaSpecificationExecutor<TenantRequest> {
}
