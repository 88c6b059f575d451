package com.example.rentalrepairs;

import com.example.rentalrepairs.model.entity.Property;
import com.example.rentalrepairs.model.entity.Tenant;
import com.example.rentalrepairs.model.entity.TenantRequest;
import com.example.rentalrepairs.service.PropertyService;
import com.example.rentalrepairs.service.RegisterPropertyCommand;
import com.example.rentalrepairs.service.RegisterWorkerCommand;
import com.example.rentalrepairs.service.SubmitRequestCommand;
import com.example.rentalrepairs.service.TenantRequestService;
import com.example.rentalrepairs.service.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Optionally seeds one property with a tenant and a small crew so the request flow can be tried at once:
 *
 *  ELM      → property managed by super@elm.example, units 1A..2B
 *  tenant   → ann@elm.example in unit 1A, with one open leak report
 *  workers  → a plumber, an electrician and a general handyman
 *
 * Enabled with rental-repairs.seed-demo-data=true.
 */
@SpringBootApplication
public class RentalRepairsApplication {

    private static final Logger log = LoggerFactory.getLogger(RentalRepairsApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RentalRepairsApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rental-repairs", name = "seed-demo-data", havingValue = "true")
    CommandLineRunner seedDemoData(PropertyService propertyService,
                                   WorkerService workerService,
                                   TenantRequestService requestService) {
        return args -> {
            Property property = propertyService.registerProperty(new RegisterPropertyCommand("ELM", "Elm Court",
                    "12 Elm Street", "Springfield", "11111", "super@elm.example", List.of("1A", "1B", "2A", "2B")));
            Tenant tenant = propertyService.registerTenant(property.getId(), "ann@elm.example", "Ann Tenant", "1A");

            workerService.registerWorker(new RegisterWorkerCommand("pat@crew.example", "Pat Plumber", "plumbing"));
            workerService.registerWorker(new RegisterWorkerCommand("eli@crew.example", "Eli Sparks", "electrical"));
            workerService.registerWorker(new RegisterWorkerCommand("gus@crew.example", "Gus Handy", "general maintenance"));

            TenantRequest request = requestService.submitRequest(new SubmitRequestCommand(property.getId(),
                    tenant.getId(), "Leaking kitchen tap", "Water drips from the tap all night", null, "high"),
                    tenant.getEmail());

            log.info("[SEED] property={} tenant={} request={} specialization={}",
                    property.getCode(), tenant.getEmail(), request.getCode(), request.getRequiredSpecialization());
            log.info("==========================================================");
            log.info("  Demo data seeded. Try (header X-User-Id: super@elm.example):");
            log.info("  GET  /requests?propertyId={}", property.getId());
            log.info("  GET  /requests/{}/eligible-workers", request.getId());
            log.info("  GET  /metrics/summary");
            log.info("==========================================================");
        };
    }
}
