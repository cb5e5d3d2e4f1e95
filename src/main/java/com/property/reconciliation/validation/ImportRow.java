package com.property.reconciliation.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One untyped input row: an ordered column to raw value mapping plus the
 * 1-based row number it was read from. Immutable.
 */
public final class ImportRow {

    /** Row number of the first data row when row 1 holds the headers. */
    public static final int FIRST_DATA_ROW = 2;

    private final int rowNumber;
    private final Map<String, String> values;

    private ImportRow(int rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        this.values = values;
    }

    public static ImportRow of(int rowNumber, Map<String, String> values) {
        if (rowNumber < 1) {
            throw new IllegalArgumentException("rowNumber must be 1-based");
        }
        Objects.requireNonNull(values, "values are required");
        return new ImportRow(rowNumber, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Numbers already-parsed rows the way a spreadsheet shows them: the header is row 1,
     * so the first data row is row 2.
     */
    public static List<ImportRow> sequence(List<? extends Map<String, String>> rows) {
        List<ImportRow> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            result.add(of(i + FIRST_DATA_ROW, rows.get(i)));
        }
        return result;
    }

    public int rowNumber() {
        return rowNumber;
    }

    /**
     * Returns the trimmed value of a column, or null when the column is missing or blank.
     */
    public String value(String column) {
        String raw = values.get(column);
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Returns the first non-blank value among the given columns.
     */
    public String firstValue(List<String> columns) {
        for (String column : columns) {
            String v = value(column);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    public String raw(String column) {
        return values.get(column);
    }

    public boolean hasValue(String column) {
        return value(column) != null;
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportRow other)) return false;
        return rowNumber == other.rowNumber && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, values);
    }

    @Override
    public String toString() {
        return "ImportRow{row=" + rowNumber + ", values=" + values + '}';
    }
}
