package com.property.reconciliation.core.model;

public enum PropertyStatus {
    PUBLISHED,
    HIDDEN,
    ONBOARDING,
    OFFBOARDED
}
