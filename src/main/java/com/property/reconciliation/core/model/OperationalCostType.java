package com.property.reconciliation.core.model;

public enum OperationalCostType {
    HOUSEKEEPING,
    HOUSEKEEPING_AT_CHECKOUT,
    LINEN_CHANGE,
    OPERATIONAL_PACKAGE
}
