package com.example.rentalrepairs.model.enums;

import com.example.rentalrepairs.exception.DomainValidationException;

import java.util.Locale;

public enum TenantRequestUrgency {

    LOW(168),
    NORMAL(72),
    HIGH(24),
    CRITICAL(4),
    EMERGENCY(2);

    private final int expectedResolutionHours;

    TenantRequestUrgency(int expectedResolutionHours) {
        this.expectedResolutionHours = expectedResolutionHours;
    }

    public int getExpectedResolutionHours() {
        return expectedResolutionHours;
    }

    public boolean requiresImmediateAttention() {
        return this == CRITICAL || this == EMERGENCY;
    }

    /**
     * Blank input means {@link #NORMAL}; anything else must name a level.
     */
    public static TenantRequestUrgency parse(String text) {
        if (text == null || text.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DomainValidationException("urgency", "Invalid urgency level: " + text);
        }
    }
}
