package com.example.rentalrepairs.model.entity;

import com.example.rentalrepairs.exception.DomainValidationException;
import com.example.rentalrepairs.exception.InvariantRule;
import com.example.rentalrepairs.exception.InvariantViolationException;
import com.example.rentalrepairs.model.enums.TenantRequestUrgency;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Property aggregate root: owns its units, its tenants and the registry of requests filed
 * against it. Requests are only ever created through {@link #fileRequest}, so every request
 * belongs to exactly one existing, active property.
 */
@Entity
@Table(name = "properties")
public class Property {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false)
    private String code;

    @Column(nullable = false)
    private String name;

    @Embedded
    private PropertyAddress address;

    @Column(nullable = false)
    private String superintendentEmail;

    private boolean active;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "property_units", joinColumns = @JoinColumn(name = "property_id"))
    @Column(name = "unit_number", nullable = false)
    @OrderColumn(name = "position")
    private List<String> units = new ArrayList<>();

    @OneToMany(mappedBy = "property", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    private Set<Tenant> tenants = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "property_requests", joinColumns = @JoinColumn(name = "property_id"))
    @Column(name = "request_id", nullable = false)
    @OrderColumn(name = "position")
    private List<UUID> requestIds = new ArrayList<>();

    private int requestSequence;

    private LocalDateTime registeredAt;

    @Version
    private Long version;

    protected Property() {
    }

    public Property(String code, String name, PropertyAddress address, String superintendentEmail,
                    List<String> units, LocalDateTime registeredAt) {
        this.id = UUID.randomUUID();
        this.code = Guard.requireText("code", code, 20).toUpperCase(Locale.ROOT);
        this.name = Guard.requireText("name", name, 200);
        this.address = Guard.requireNonNull("address", address);
        this.superintendentEmail = Guard.requireEmail("superintendentEmail", superintendentEmail);
        if (units == null || units.isEmpty()) {
            throw new DomainValidationException("units", "A property needs at least one unit");
        }
        for (String unit : units) {
            String unitNumber = Guard.requireText("units", unit);
            if (this.units.contains(unitNumber)) {
                throw new DomainValidationException("units", "Duplicate unit number: " + unitNumber);
            }
            this.units.add(unitNumber);
        }
        this.active = true;
        this.registeredAt = registeredAt;
    }

    /**
     * Moves a new tenant into a vacant unit.
     */
    public Tenant registerTenant(String email, String fullName, String unitNumber, LocalDateTime now) {
        requireActive();
        String unit = Guard.requireText("unitNumber", unitNumber);
        if (!units.contains(unit) || !isUnitAvailable(unit)) {
            throw new InvariantViolationException(InvariantRule.UNIT_UNAVAILABLE, "Property", id,
                    "Unit " + unit + " does not exist or is occupied at property " + code);
        }
        String normalizedEmail = Guard.requireEmail("email", email);
        if (findTenantByEmail(normalizedEmail).isPresent()) {
            throw new InvariantViolationException(InvariantRule.DUPLICATE_TENANT, "Property", id,
                    "Tenant " + normalizedEmail + " is already registered at property " + code);
        }
        Tenant tenant = new Tenant(this, normalizedEmail, fullName, unit, now);
        tenants.add(tenant);
        return tenant;
    }

    /**
     * Creates a request for one of this property's tenants. The required specialization must come
     * from the specialization determination service.
     */
    public TenantRequest fileRequest(UUID tenantId, String title, String description, String categoryHint,
                                     TenantRequestUrgency urgency, WorkerSpecialization requiredSpecialization,
                                     String actorId, LocalDateTime now) {
        requireActive();
        Tenant tenant = findTenant(tenantId).orElseThrow(() -> new InvariantViolationException(
                InvariantRule.TENANT_NOT_OF_PROPERTY, "Property", id,
                "Tenant " + tenantId + " does not live at property " + code));

        requestSequence++;
        String requestCode = code + "-" + requestSequence;
        TenantRequest request = new TenantRequest(id, requestCode, tenant.getId(), title, description,
                categoryHint, requiredSpecialization, urgency, actorId, now);
        requestIds.add(request.getId());
        return request;
    }

    public void changeSuperintendent(String email) {
        this.superintendentEmail = Guard.requireEmail("superintendentEmail", email);
    }

    public void deactivate() {
        this.active = false;
    }

    public void activate() {
        this.active = true;
    }

    public boolean isUnitAvailable(String unitNumber) {
        return tenants.stream().noneMatch(t -> t.getUnitNumber().equals(unitNumber));
    }

    public Optional<Tenant> findTenant(UUID tenantId) {
        return tenants.stream().filter(t -> t.getId().equals(tenantId)).findFirst();
    }

    public Optional<Tenant> findTenantByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return tenants.stream().filter(t -> t.getEmail().equals(normalized)).findFirst();
    }

    public boolean isManagedBy(String email) {
        return email != null && superintendentEmail.equalsIgnoreCase(email.trim());
    }

    public boolean ownsRequest(UUID requestId) {
        return requestIds.contains(requestId);
    }

    private void requireActive() {
        if (!active) {
            throw new InvariantViolationException(InvariantRule.PROPERTY_INACTIVE, "Property", id,
                    "Property " + code + " is not active");
        }
    }

    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public PropertyAddress getAddress() {
        return address;
    }

    public String getSuperintendentEmail() {
        return superintendentEmail;
    }

    public boolean isActive() {
        return active;
    }

    public List<String> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public List<Tenant> getTenants() {
        return tenants.stream()
                .sorted(Comparator.comparing(Tenant::getUnitNumber))
                .toList();
    }

    public List<UUID> getRequestIds() {
        return Collections.unmodifiableList(requestIds);
    }

    public LocalDateTime getRegisteredAt() {
        return registeredAt;
    }

    public Long getVersion() {
        return version;
    }
}
