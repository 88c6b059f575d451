package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface PropertyJpaRepository extends JpaRepository<Property, UUID>, JpaSpecificationExecutor<Property> {

    @Query("select distinct p from Property p join p.tenants t where t.email = :email")
    List<Property> findByTenantEmail(@Param("email") String email);
}
