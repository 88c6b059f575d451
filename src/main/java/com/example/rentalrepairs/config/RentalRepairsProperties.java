package com.example.rentalrepairs.config;

import com.example.rentalrepairs.model.enums.GeneralFallbackPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for request handling and worker assignment.
 *
 * @param assignment   worker capacity and matching rules
 * @param security     principals the system acts as
 * @param seedDemoData whether to load the demo property, tenant and workers on startup
 */
@ConfigurationProperties(prefix = "rental-repairs")
public record RentalRepairsProperties(
        Assignment assignment,
        Security security,
        boolean seedDemoData
) {

    public RentalRepairsProperties {
        assignment = assignment != null ? assignment : new Assignment(null, null);
        security = security != null ? security : new Security(null);
    }

    /**
     * @param maxConcurrentAssignments requests a worker may hold in ASSIGNED or IN_PROGRESS at once
     * @param generalFallback          when general-maintenance workers may cover a specialist request
     */
    public record Assignment(Integer maxConcurrentAssignments, GeneralFallbackPolicy generalFallback) {

        public Assignment {
            maxConcurrentAssignments = maxConcurrentAssignments != null ? maxConcurrentAssignments : 3;
            generalFallback = generalFallback != null ? generalFallback : GeneralFallbackPolicy.WHEN_NO_SPECIALIST_AVAILABLE;
            if (maxConcurrentAssignments < 1) {
                throw new IllegalArgumentException("rental-repairs.assignment.max-concurrent-assignments must be at least 1");
            }
        }
    }

    /**
     * @param systemPrincipals user ids that act with the system role (schedulers, integrations)
     */
    public record Security(List<String> systemPrincipals) {

        public Security {
            systemPrincipals = systemPrincipals != null ? List.copyOf(systemPrincipals) : List.of("system");
        }
    }
}
