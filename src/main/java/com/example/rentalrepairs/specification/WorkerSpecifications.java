package com.example.rentalrepairs.specification;

import com.example.rentalrepairs.model.entity.Worker;
import com.example.rentalrepairs.model.enums.WorkerSpecialization;

import java.util.Locale;

public final class WorkerSpecifications {

    private WorkerSpecifications() {
    }

    public static Specification<Worker> active() {
        return Specification.isTrue("active", Worker::isActive);
    }

    public static Specification<Worker> available() {
        return Specification.isTrue("available", Worker::isAvailable);
    }

    public static Specification<Worker> withSpecialization(WorkerSpecialization specialization) {
        return Specification.equal("specialization", Worker::getSpecialization, specialization);
    }

    public static Specification<Worker> belowCapacity(int maxConcurrentAssignments) {
        return Specification.lessThan("activeAssignmentCount", Worker::getActiveAssignmentCount, maxConcurrentAssignments);
    }

    public static Specification<Worker> byEmail(String email) {
        return Specification.equal("email", Worker::getEmail, email.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Workers of exactly this specialization that could take one more request right now,
     * least loaded first.
     */
    public static Specification<Worker> eligibleFor(WorkerSpecialization specialization, int maxConcurrentAssignments) {
        return withSpecialization(specialization)
                .and(active())
                .and(available())
                .and(belowCapacity(maxConcurrentAssignments))
                .orderBy("activeAssignmentCount")
                .orderBy("email");
    }
}
