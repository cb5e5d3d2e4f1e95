package com.property.reconciliation.core.model;

/**
 * Kind of occupation a booking represents on the property calendar.
 */
public enum BookingType {
    CONFIRMED,
    TENTATIVE,
    BLOCKED,
    MAINTENANCE,
    OWNER,
    OWNER_STAY,
    CONTRACT;

    /**
     * Guest bookings must name the guest; blocks and owner stays do not.
     */
    public boolean requiresGuest() {
        return this == CONFIRMED || this == TENTATIVE || this == CONTRACT;
    }
}
