package com.example.rentalrepairs.repository;

import com.example.rentalrepairs.model.entity.Property;

import java.util.List;

public interface PropertyRepository extends AggregateRepository<Property> {

    /** Properties with a tenant registered under the given email. */
    List<Property> findByTenantEmail(String email);
}
