package com.example.rentalrepairs.service;

import com.example.rentalrepairs.model.enums.WorkerSpecialization;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Works out which trade a request needs. The only place a request's required specialization
 * comes from.
 *
 * A valid category hint wins. Otherwise the description is matched against keyword lists in a
 * fixed priority order, the more specific trades first (an oven that leaks is an appliance job,
 * a lock on a door is a locksmith job). Anything unmatched goes to general maintenance so that
 * filing a request never fails on classification.
 */
@Service
public class SpecializationDeterminationService {

    private static final Map<WorkerSpecialization, List<String>> KEYWORDS_BY_PRIORITY = new LinkedHashMap<>();

    static {
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.APPLIANCE_REPAIR, List.of(
                "appliance", "refrigerator", "fridge", "washer", "dryer", "dishwasher", "oven", "stove",
                "microwave", "freezer"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.LOCKSMITH, List.of(
                "lock", "key", "deadbolt", "locked out", "lockout", "unlock", "rekey"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.PLUMBING, List.of(
                "plumb", "leak", "water", "drain", "pipe", "faucet", "tap", "toilet", "sink", "clog",
                "drip", "flush", "sewer"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.ELECTRICAL, List.of(
                "electric", "power", "outlet", "wiring", "light", "switch", "breaker", "circuit", "lamp",
                "fixture", "voltage", "spark"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.HVAC, List.of(
                "hvac", "furnace", "thermostat", "ventilation", "conditioner", "heating", "cooling",
                "heat pump", "air conditioning", "radiator"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.PAINTING, List.of(
                "paint", "repaint", "peeling", "stain"));
        KEYWORDS_BY_PRIORITY.put(WorkerSpecialization.CARPENTRY, List.of(
                "wood", "cabinet", "carpenter", "shelf", "shelves", "door frame", "cupboard", "floorboard"));
    }

    /**
     * @param description  free text written by the tenant, may be blank
     * @param categoryHint optional category chosen by the tenant; ignored when it names no trade
     */
    public WorkerSpecialization determineSpecialization(String description, String categoryHint) {
        WorkerSpecialization hinted = WorkerSpecialization.tryParse(categoryHint);
        if (hinted != null) {
            return hinted;
        }
        if (description == null || description.isBlank()) {
            return WorkerSpecialization.GENERAL_MAINTENANCE;
        }

        String text = description.toLowerCase(Locale.ROOT);
        for (Map.Entry<WorkerSpecialization, List<String>> entry : KEYWORDS_BY_PRIORITY.entrySet()) {
            if (entry.getValue().stream().anyMatch(text::contains)) {
                return entry.getKey();
            }
        }
        return WorkerSpecialization.GENERAL_MAINTENANCE;
    }
}
