package com.property.reconciliation.validation;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one typed field read from one or more source columns.
 * The first non-blank column wins.
 *
 * @param name            field name in the validated record
 * @param columns         source columns, in priority order
 * @param type            declared type
 * @param required        whether a blank value is a row error
 * @param requiredMessage error message used when a required field is blank
 * @param enumMapping     fallback table for {@link FieldType#ENUM} fields
 * @param min             inclusive lower bound for numeric fields, may be null
 * @param max             inclusive upper bound for numeric fields, may be null
 */
public record FieldSpec(
        String name,
        List<String> columns,
        FieldType type,
        boolean required,
        String requiredMessage,
        EnumMapping<?> enumMapping,
        BigDecimal min,
        BigDecimal max
) {
    public FieldSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        columns = columns != null && !columns.isEmpty() ? List.copyOf(columns) : List.of(name);
        if (type == FieldType.ENUM && enumMapping == null) {
            throw new IllegalArgumentException("ENUM field '" + name + "' needs an enum mapping");
        }
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, null, FieldType.TEXT, false, null, null, null, null);
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, null, FieldType.INTEGER, false, null, null, null, null);
    }

    public static FieldSpec decimal(String name) {
        return new FieldSpec(name, null, FieldType.DECIMAL, false, null, null, null, null);
    }

    public static FieldSpec date(String name) {
        return new FieldSpec(name, null, FieldType.DATE, false, null, null, null, null);
    }

    public static FieldSpec email(String name) {
        return new FieldSpec(name, null, FieldType.EMAIL, false, null, null, null, null);
    }

    public static FieldSpec list(String name) {
        return new FieldSpec(name, null, FieldType.LIST, false, null, null, null, null);
    }

    public static FieldSpec enumerated(String name, EnumMapping<?> mapping) {
        return new FieldSpec(name, null, FieldType.ENUM, false, null, mapping, null, null);
    }

    public FieldSpec from(String... sourceColumns) {
        return new FieldSpec(name, List.of(sourceColumns), type, required, requiredMessage, enumMapping, min, max);
    }

    public FieldSpec required(String message) {
        return new FieldSpec(name, columns, type, true, message, enumMapping, min, max);
    }

    public FieldSpec between(double minimum, double maximum) {
        return new FieldSpec(name, columns, type, required, requiredMessage, enumMapping,
                BigDecimal.valueOf(minimum), BigDecimal.valueOf(maximum));
    }

    public FieldSpec nonNegative() {
        return new FieldSpec(name, columns, type, required, requiredMessage, enumMapping, BigDecimal.ZERO, max);
    }

    String missingMessage() {
        return requiredMessage != null ? requiredMessage : name + " is required";
    }
}
