package com.example.rentalrepairs.repository;

import com.example.rentalrepairs.model.entity.TenantRequest;

public interface TenantRequestRepository extends AggregateRepository<TenantRequest> {
}
