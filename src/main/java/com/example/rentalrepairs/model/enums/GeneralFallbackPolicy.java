package com.example.rentalrepairs.model.enums;

/**
 * When a general-maintenance worker may take a request that needs a specific trade.
 */
public enum GeneralFallbackPolicy {

    /** Only exact specialization matches. */
    NEVER,

    /** General maintenance is allowed once no active specialist has spare capacity. */
    WHEN_NO_SPECIALIST_AVAILABLE,

    /** General maintenance is always an acceptable match. */
    ALWAYS
}
