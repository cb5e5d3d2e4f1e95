package com.property.reconciliation.bulk;

/**
 * The sheet layouts the reconciler understands.
 */
public enum ImportTarget {
    PROPERTIES("properties"),
    BOOKINGS("bookings"),
    CONTACTS("contacts"),
    /** Pricing periods of existing properties. */
    PRICE_RANGES("price_ranges"),
    /** One sheet carrying a property plus optional pricing, cost, booking and request sections. */
    COMBINED("combined");

    private final String label;

    ImportTarget(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
