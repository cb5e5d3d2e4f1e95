package com.property.reconciliation.validation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed view over a validated row. Fields absent from the input, or dropped
 * because they could not be coerced, are simply missing.
 */
public final class ValidatedRow {

    private final int rowNumber;
    private final Map<String, Object> values;

    ValidatedRow(int rowNumber, Map<String, Object> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(values);
    }

    public int rowNumber() {
        return rowNumber;
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public String getString(String field) {
        return (String) values.get(field);
    }

    public Integer getInteger(String field) {
        return (Integer) values.get(field);
    }

    public BigDecimal getDecimal(String field) {
        return (BigDecimal) values.get(field);
    }

    public LocalDate getDate(String field) {
        return (LocalDate) values.get(field);
    }

    public <E extends Enum<E>> E getEnum(String field, Class<E> type) {
        Object value = values.get(field);
        return value != null ? type.cast(value) : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String field) {
        Object value = values.get(field);
        return value != null ? (List<String>) value : List.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ValidatedRow{row=" + rowNumber + ", values=" + values + '}';
    }
}
