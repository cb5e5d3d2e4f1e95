package com.property.reconciliation.core.model;

public enum RequestUrgency {
    LOW,
    MEDIUM,
    HIGH
}
