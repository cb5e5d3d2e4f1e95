package com.property.reconciliation.core.model;

/**
 * Kinds of canonical records the reconciliation engine reads and writes.
 * The label is the value written to audit entries.
 */
public enum EntityType {
    DESTINATION("destination"),
    PROPERTY("property"),
    CONTACT("contact"),
    CONTACT_PROPERTY_LINK("contact_property"),
    BOOKING("booking"),
    PRICE_RANGE("price_range"),
    OPERATIONAL_COST("operational_cost"),
    AVAILABILITY_REQUEST("availability_request");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
