package com.example.rentalrepairs.service;

import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.PropertyAddress;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.repository.PropertyRepository;
import com.example.rentalrepairs.specification.PropertySpecifications;
import com.example.rentalrepairs.specification.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class PropertyService {

    private static final Logger log = LoggerFactory.getLogger(PropertyService.class);

    private final PropertyRepository propertyRepository;
    private final Clock clock;

    public PropertyService(PropertyRepository propertyRepository, Clock clock) {
        this.propertyRepository = propertyRepository;
        this.clock = clock;
    }

    @Transactional
    public Property registerProperty(RegisterPropertyCommand command) {
        Property property = new Property(command.code(), command.name(),
                new PropertyAddress(command.street(), command.city(), command.postalCode()),
                command.superintendentEmail(), command.units(), LocalDateTime.now(clock));
        if (propertyRepository.count(PropertySpecifications.byCode(property.getCode())) > 0) {
            throw duplicateProperty(property);
        }
        try {
            propertyRepository.add(property);
        } catch (DataIntegrityViolationException e) {
            throw duplicateProperty(property);
        }
        log.info("[PROPERTY REGISTERED] code={} units={} superintendent={}",
                property.getCode(), property.getUnits().size(), property.getSuperintendentEmail());
        return property;
    }

    @Transactional
    public Tenant registerTenant(UUID propertyId, String email, String fullName, String unitNumber) {
        Property property = propertyRepository.get(propertyId);
        Tenant tenant = property.registerTenant(email, fullName, unitNumber, LocalDateTime.now(clock));
        propertyRepository.update(property);
        log.info("[TENANT REGISTERED] property={} unit={} tenant={}", property.getCode(), unitNumber, tenant.getEmail());
        return tenant;
    }

    @Transactional
    public Property changeSuperintendent(UUID propertyId, String email) {
        Property property = propertyRepository.get(propertyId);
        String previous = property.getSuperintendentEmail();
        property.changeSuperintendent(email);
        propertyRepository.update(property);
        log.info("[SUPERINTENDENT CHANGED] property={} {} → {}", property.getCode(), previous, property.getSuperintendentEmail());
        return property;
    }

    @Transactional
    public Property deactivate(UUID propertyId) {
        Property property = propertyRepository.get(propertyId);
        property.deactivate();
        propertyRepository.update(property);
        log.info("[PROPERTY DEACTIVATED] property={}", property.getCode());
        return property;
    }

    @Transactional(readOnly = true)
    public Property getProperty(UUID propertyId) {
        return propertyRepository.get(propertyId);
    }

    @Transactional(readOnly = true)
    public List<Property> findProperties(Specification<Property> specification) {
        return propertyRepository.find(specification);
    }

    private static InvariantViolationException duplicateProperty(Property property) {
        return new InvariantViolationException(InvariantRule.DUPLICATE_PROPERTY, "Property", property.getCode(),
                "A property with code " + property.getCode() + " is already registered");
    }
}
