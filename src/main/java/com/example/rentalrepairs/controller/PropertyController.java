package com.example.rentalrepairs.controller;

import com.example.rentalrepairs.controller.dto.PropertyDtos.PropertyResponse;
import com.example.rentalrepairs.controller.dto.PropertyDtos.RegisterPropertyRequest;
import com.example.rentalrepairs.controller.dto.PropertyDtos.RegisterTenantRequest;
import com.example.rentalrepairs.controller.dto.PropertyDtos.TenantResponse;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.service.PropertyService;
import com.example.rentalrepairs.service.RegisterPropertyCommand;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/properties")
public class PropertyController {

    private final PropertyService propertyService;

    public PropertyController(PropertyService propertyService) {
        this.propertyService = propertyService;
    }

    @PostMapping
    public ResponseEntity<PropertyResponse> register(@Valid @RequestBody RegisterPropertyRequest body) {
        Property property = propertyService.registerProperty(new RegisterPropertyCommand(body.code(), body.name(),
                body.street(), body.city(), body.postalCode(), body.superintendentEmail(), body.units()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PropertyResponse.from(property));
    }

    @GetMapping("/{propertyId}")
    public PropertyResponse get(@PathVariable UUID propertyId) {
        return PropertyResponse.from(propertyService.getProperty(propertyId));
    }

    /** Move a tenant into a vacant unit */
    @PostMapping("/{propertyId}/tenants")
    public ResponseEntity<TenantResponse> registerTenant(@PathVariable UUID propertyId,
                                                         @Valid @RequestBody RegisterTenantRequest body) {
        Tenant tenant = propertyService.registerTenant(propertyId, body.email(), body.fullName(), body.unitNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(TenantResponse.from(tenant));
    }

    @PostMapping("/{propertyId}/deactivate")
    public PropertyResponse deactivate(@PathVariable UUID propertyId) {
        return PropertyResponse.from(propertyService.deactivate(propertyId));
    }
}
