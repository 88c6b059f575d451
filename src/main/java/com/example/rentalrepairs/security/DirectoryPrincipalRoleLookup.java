package com.example.rentalrepairs.security;

import com.example.rentalrepairs.config.RentalRepairsProperties;
import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.PrincipalRole;
import com.example.rentalrepairs.repository.PropertyRepository;
import com.example.rentalrepairs.repository.WorkerRepository;
import com.example.rentalrepairs.specification.PropertySpecifications;
import com.example.rentalrepairs.specification.WorkerSpecifications;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Derives roles from the email addresses recorded on the aggregates: a user id is the email of a
 * tenant, a worker or a superintendent, or one of the configured system principals.
 */
@Component
public class DirectoryPrincipalRoleLookup implements PrincipalRoleLookup {

    private final PropertyRepository propertyRepository;
    private final WorkerRepository workerRepository;
    private final Set<String> systemPrincipals;

    public DirectoryPrincipalRoleLookup(PropertyRepository propertyRepository,
                                        WorkerRepository workerRepository,
                                        RentalRepairsProperties properties) {
        this.propertyRepository = propertyRepository;
        this.workerRepository = workerRepository;
        this.systemPrincipals = new HashSet<>();
        properties.security().systemPrincipals()
                .forEach(id -> systemPrincipals.add(id.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public Principal resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            return Principal.anonymous(userId);
        }
        String normalized = userId.trim().toLowerCase(Locale.ROOT);
        Set<PrincipalRole> roles = EnumSet.noneOf(PrincipalRole.class);
        if (systemPrincipals.contains(normalized)) {
            roles.add(PrincipalRole.SYSTEM);
        }

        Set<UUID> tenantIds = new HashSet<>();
        for (Property property : propertyRepository.findByTenantEmail(normalized)) {
            property.findTenantByEmail(normalized).map(Tenant::getId).ifPresent(tenantIds::add);
        }
        if (!tenantIds.isEmpty()) {
            roles.add(PrincipalRole.TENANT);
        }

        UUID workerId = null;
        if (normalized.contains("@")) {
            List<Worker> workers = workerRepository.find(WorkerSpecifications.byEmail(normalized));
            if (!workers.isEmpty()) {
                workerId = workers.get(0).getId();
                roles.add(PrincipalRole.WORKER);
            }
        }

        Set<UUID> managed = new HashSet<>();
        if (normalized.contains("@")) {
            propertyRepository.find(PropertySpecifications.managedBy(normalized))
                    .forEach(property -> managed.add(property.getId()));
        }
        if (!managed.isEmpty()) {
            roles.add(PrincipalRole.SUPERINTENDENT);
        }

        return new Principal(userId.trim(), roles, tenantIds, workerId, managed);
    }
}
