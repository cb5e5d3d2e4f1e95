package com.property.reconciliation.validation;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a row carries data for an optional section. The section is
 * present as soon as any one of its marker columns is non-blank; the other
 * columns of the section may still be empty.
 */
public record PresenceRule(String section, List<String> markerColumns) {

    public PresenceRule {
        Objects.requireNonNull(section, "section is required");
        if (markerColumns == null || markerColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one marker column is required");
        }
        markerColumns = List.copyOf(markerColumns);
    }

    public static PresenceRule of(String section, String... markerColumns) {
        return new PresenceRule(section, List.of(markerColumns));
    }

    public boolean isPresent(ImportRow row) {
        for (String column : markerColumns) {
            if (row.hasValue(column)) {
                return true;
            }
        }
        return false;
    }
}
