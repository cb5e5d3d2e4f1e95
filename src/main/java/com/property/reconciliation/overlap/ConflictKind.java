package com.property.reconciliation.overlap;

/**
 * How a candidate range collides with an existing one.
 */
public enum ConflictKind {
    /** The ranges share some but not all days. */
    OVERLAP,
    /** The candidate covers the whole existing range. */
    ENCOMPASSING,
    /** The existing range covers the whole candidate. */
    ENCOMPASSED
}
