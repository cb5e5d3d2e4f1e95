package com.property.reconciliation.bulk;

import java.util.Locale;

/**
 * How rows whose identity already exists are treated.
 */
public enum ImportMode {
    /** Only new records; an existing identity fails the row. */
    CREATE("create"),
    /** Only existing records; an unknown identity fails the row. */
    UPDATE("update"),
    /** Create or update, decided per row. */
    BOTH("both");

    private final String label;

    ImportMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @throws IllegalArgumentException for anything but create, update or both
     */
    public static ImportMode fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ImportMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported import mode: " + value);
    }
}
