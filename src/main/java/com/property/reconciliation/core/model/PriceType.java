package com.property.reconciliation.core.model;

public enum PriceType {
    PER_STAY,
    PER_WEEK,
    PER_DAY,
    FIXED
}
