package com.property.reconciliation.core.model;

/**
 * Lifecycle of an availability request.
 */
public enum RequestStatus {
    PENDING,
    CONFIRMED,
    REJECTED
}
