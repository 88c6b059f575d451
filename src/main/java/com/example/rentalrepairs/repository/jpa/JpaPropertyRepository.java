package com.example.rentalrepairs.repository.jpa;

import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.repository.PropertyRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;

@Repository
public class JpaPropertyRepository extends JpaAggregateRepository<Property, PropertyJpaRepository>
        implements PropertyRepository {

    public JpaPropertyRepository(PropertyJpaRepository jpaRepository, EntityManager entityManager) {
        super(Property.class, Property::getId, jpaRepository, entityManager);
    }

    @Override
    public List<Property> findByTenantEmail(String email) {
        if (email == null) {
            return List.of();
        }
        return jpaRepository.findByTenantEmail(email.trim().toLowerCase(Locale.ROOT));
    }
}
