package com.example.rentalrepairs.security;

import com.example.rentalrepairs.model.enums.PrincipalRole;

import java.util.Set;
import java.util.UUID;

/**
 * Who is acting and how they relate to properties, tenancies and work.
 *
 * @param tenantIds           tenancies held by the user
 * @param workerId            worker record of the user, if any
 * @param managedPropertyIds  properties the user is superintendent of
 */
public record Principal(
        String userId,
        Set<PrincipalRole> roles,
        Set<UUID> tenantIds,
        UUID workerId,
        Set<UUID> managedPropertyIds) {

    public Principal {
        roles = Set.copyOf(roles);
        tenantIds = Set.copyOf(tenantIds);
        managedPropertyIds = Set.copyOf(managedPropertyIds);
    }

    public static Principal anonymous(String userId) {
        return new Principal(userId, Set.of(), Set.of(), null, Set.of());
    }

    public boolean isSystem() {
        return roles.contains(PrincipalRole.SYSTEM);
    }

    public boolean isTenant(UUID tenantId) {
        return tenantId != null && tenantIds.contains(tenantId);
    }

    public boolean isWorker(UUID workerId) {
        return workerId != null && workerId.equals(this.workerId);
    }

    public boolean manages(UUID propertyId) {
        return managedPropertyIds.contains(propertyId);
    }
}
