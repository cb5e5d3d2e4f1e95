package com.property.reconciliation.core.model;

public enum ContactPropertyRelationship {
    OWNER,
    RENTER,
    STAFF,
    MAINTENANCE,
    OTHER
}
