package com.example.rentalrepairs.model.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A tenant living in one unit of a property. Only ever created and reached through its
 * {@link Property}.
 */
@Entity
@Table(name = "tenants")
public class Tenant {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "property_id", nullable = false, updatable = false)
    private Property property;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String fullName;

    @Column(nullable = false)
    private String unitNumber;

    private LocalDateTime registeredAt;

    protected Tenant() {
    }

    Tenant(Property property, String email, String fullName, String unitNumber, LocalDateTime registeredAt) {
        this.id = UUID.randomUUID();
        this.property = property;
        this.email = Guard.requireEmail("tenant.email", email);
        this.fullName = Guard.requireText("tenant.fullName", fullName, 200);
        this.unitNumber = Guard.requireText("tenant.unitNumber", unitNumber);
        this.registeredAt = registeredAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPropertyId() {
        return property.getId();
    }

    public String getEmail() {
        return email;
    }

    public String getFullName() {
        return fullName;
    }

    public String getUnitNumber() {
        return unitNumber;
    }

    public LocalDateTime getRegisteredAt() {
        return registeredAt;
    }

    public boolean belongsTo(UUID propertyId) {
        return property.getId().equals(propertyId);
    }
}
