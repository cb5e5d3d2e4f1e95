package com.property.reconciliation.core.model;

public enum BookingSource {
    MANUAL,
    IMPORT
}
