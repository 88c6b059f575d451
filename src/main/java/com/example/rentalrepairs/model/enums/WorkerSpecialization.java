package com.example.rentalrepairs.model.enums;

import com.example.rentalrepairs.exception.DomainValidationException;

import java.util.List;
import java.util.Locale;

/**
 * Trade a worker is qualified for and a request requires.
 * Closed set: every place that maps text to a specialization goes through {@link #parse(String)}.
 */
public enum WorkerSpecialization {

    GENERAL_MAINTENANCE("General Maintenance", "Can handle any type of maintenance work",
            List.of("general", "maintenance", "handyman")),
    PLUMBING("Plumbing", "Leaks, pipes, drains, toilets",
            List.of("plumber")),
    ELECTRICAL("Electrical", "Outlets, wiring, lights, circuits",
            List.of("electrician")),
    HVAC("HVAC", "Heating, cooling, ventilation",
            List.of("hvac technician", "heating", "cooling")),
    CARPENTRY("Carpentry", "Wood, cabinets, doors, frames",
            List.of("carpenter")),
    PAINTING("Painting", "Walls, ceilings, trim",
            List.of("painter")),
    LOCKSMITH("Locksmith", "Locks, keys, security",
            List.of()),
    APPLIANCE_REPAIR("Appliance Repair", "Refrigerators, washers, dryers, ovens",
            List.of("appliance technician", "appliances"));

    private final String displayName;
    private final String description;
    private final List<String> aliases;

    WorkerSpecialization(String displayName, String description, List<String> aliases) {
        this.displayName = displayName;
        this.description = description;
        this.aliases = aliases;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * General maintenance covers any trade; everyone else only their own.
     */
    public boolean canHandle(WorkerSpecialization required) {
        return this == required || this == GENERAL_MAINTENANCE;
    }

    /**
     * Resolves enum names, display names and trade aliases, ignoring case and surrounding blanks.
     *
     * @throws DomainValidationException when the text names no known specialization
     */
    public static WorkerSpecialization parse(String text) {
        WorkerSpecialization match = tryParse(text);
        if (match == null) {
            throw new DomainValidationException("specialization", "Unknown worker specialization: " + text);
        }
        return match;
    }

    /**
     * Lenient variant of {@link #parse(String)}: returns {@code null} instead of throwing.
     */
    public static WorkerSpecialization tryParse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (WorkerSpecialization specialization : values()) {
            if (specialization.name().toLowerCase(Locale.ROOT).equals(normalized.replace(' ', '_'))
                    || specialization.displayName.toLowerCase(Locale.ROOT).equals(normalized)
                    || specialization.aliases.contains(normalized)) {
                return specialization;
            }
        }
        return null;
    }
}
