package com.property.reconciliation.core.model;

public enum ContactCategory {
    CLIENT,
    OWNER,
    PROVIDER,
    ORGANIZATION,
    OTHER
}
