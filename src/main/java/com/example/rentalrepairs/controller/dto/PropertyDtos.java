package com.example.rentalrepairs.controller.dto;

import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class PropertyDtos {

    private PropertyDtos() {
    }

    public record RegisterPropertyRequest(
            @NotBlank @Size(max = 20) String code,
            @NotBlank String name,
            @NotBlank String street,
            @NotBlank String city,
            @NotBlank String postalCode,
            @NotBlank @Email String superintendentEmail,
            @NotEmpty List<String> units) {
    }

    public record RegisterTenantRequest(
            @NotBlank @Email String email,
            @NotBlank String fullName,
            @NotBlank String unitNumber) {
    }

    public record TenantResponse(UUID id, UUID propertyId, String email, String fullName, String unitNumber) {

        public static TenantResponse from(Tenant tenant) {
            return new TenantResponse(tenant.getId(), tenant.getPropertyId(), tenant.getEmail(),
                    tenant.getFullName(), tenant.getUnitNumber());
        }
    }

    public record PropertyResponse(
            UUID id,
            String code,
            String name,
            String address,
            String city,
            String superintendentEmail,
            boolean active,
            List<String> units,
            List<TenantResponse> tenants,
            int requestCount) {

        public static PropertyResponse from(Property property) {
            return new PropertyResponse(property.getId(), property.getCode(), property.getName(),
                    property.getAddress().toString(), property.getAddress().getCity(),
                    property.getSuperintendentEmail(), property.isActive(), property.getUnits(),
                    property.getTenants().stream().map(TenantResponse::from).toList(),
                    property.getRequestIds().size());
        }
    }
}
