package com.example.rentalrepairs.service;

import java.util.UUID;

/**
 * @param categoryHint optional trade chosen by the tenant
 * @param urgency      urgency level name, blank for NORMAL
 */
public record SubmitRequestCommand(
        UUID propertyId,
        UUID tenantId,
        String title,
        String description,
        String categoryHint,
        String urgency) {
}
