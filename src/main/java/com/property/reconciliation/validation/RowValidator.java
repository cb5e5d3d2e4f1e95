package com.property.reconciliation.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coerces one {@link ImportRow} against a {@link RowSchema}.
 *
 * <p>Malformed input is an expected result, not an exception: a required field
 * that is blank or cannot be coerced, an out-of-range number or a malformed email
 * is a field error. An optional value that cannot be coerced is dropped with a
 * warning, and an unrecognised enum value falls back to the mapping's default
 * with a warning.</p>
 */
public class RowValidator {
    private static final Logger log = LoggerFactory.getLogger(RowValidator.class);

    public ValidationResult validate(ImportRow row, RowSchema schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<FieldError> errors = new ArrayList<>();
        List<FieldError> warnings = new ArrayList<>();
        int rowNumber = row.rowNumber();

        for (FieldSpec spec : schema.fields()) {
            String raw = row.firstValue(spec.columns());
            if (raw == null) {
                if (spec.required()) {
                    errors.add(new FieldError(rowNumber, spec.name(), spec.missingMessage(), null));
                } else if (spec.type() == FieldType.ENUM) {
                    values.put(spec.name(), spec.enumMapping().map(null));
                }
                continue;
            }

            switch (spec.type()) {
                case TEXT -> values.put(spec.name(), raw);
                case LIST -> values.put(spec.name(), ValueCoercer.parseList(raw));
                case INTEGER -> coerceNumber(spec, raw, ValueCoercer.parseInteger(raw)
                        .map(BigDecimal::valueOf), rowNumber, values, errors, warnings, true);
                case DECIMAL -> coerceNumber(spec, raw, ValueCoercer.parseDecimal(raw),
                        rowNumber, values, errors, warnings, false);
                case DATE -> {
                    var date = ValueCoercer.parseDate(raw);
                    if (date.isPresent()) {
                        values.put(spec.name(), date.get());
                    } else {
                        reject(spec, rowNumber, raw, "Invalid date format for " + spec.name() + ". Use YYYY-MM-DD",
                                errors, warnings);
                    }
                }
                case EMAIL -> {
                    var email = ValueCoercer.parseEmail(raw);
                    if (email.isPresent()) {
                        values.put(spec.name(), email.get());
                    } else {
                        errors.add(new FieldError(rowNumber, spec.name(), "Invalid email address", raw));
                    }
                }
                case ENUM -> {
                    EnumMapping<?> mapping = spec.enumMapping();
                    values.put(spec.name(), mapping.map(raw));
                    if (!mapping.recognizes(raw)) {
                        warnings.add(new FieldError(rowNumber, spec.name(),
                                "Unrecognized " + spec.name() + " '" + raw + "', using "
                                        + mapping.getDefaultValue(), raw));
                    }
                }
            }
        }

        if (!errors.isEmpty()) {
            log.debug("row.invalid schema={} row={} errors={}", schema.getName(), rowNumber, errors.size());
            return new ValidationResult(null, errors, warnings);
        }
        return new ValidationResult(new ValidatedRow(rowNumber, values), List.of(), warnings);
    }

    private void coerceNumber(FieldSpec spec, String raw, Optional<BigDecimal> parsed, int rowNumber,
                              Map<String, Object> values, List<FieldError> errors, List<FieldError> warnings,
                              boolean whole) {
        if (parsed.isEmpty()) {
            String message = spec.name() + (whole ? " must be a whole number" : " must be a number");
            reject(spec, rowNumber, raw, message, errors, warnings);
            return;
        }
        BigDecimal number = parsed.get();
        if (spec.min() != null && number.compareTo(spec.min()) < 0
                || spec.max() != null && number.compareTo(spec.max()) > 0) {
            errors.add(new FieldError(rowNumber, spec.name(), rangeMessage(spec), raw));
            return;
        }
        values.put(spec.name(), whole ? (Object) number.intValueExact() : number);
    }

    private void reject(FieldSpec spec, int rowNumber, String raw, String message,
                        List<FieldError> errors, List<FieldError> warnings) {
        if (spec.required()) {
            errors.add(new FieldError(rowNumber, spec.name(), message, raw));
        } else {
            warnings.add(new FieldError(rowNumber, spec.name(), message + " (value ignored)", raw));
        }
    }

    private static String rangeMessage(FieldSpec spec) {
        if (spec.max() == null) {
            return spec.name() + " must not be less than " + spec.min().stripTrailingZeros().toPlainString();
        }
        if (spec.min() == null) {
            return spec.name() + " must not be greater than " + spec.max().stripTrailingZeros().toPlainString();
        }
        return spec.name() + " must be between " + spec.min().stripTrailingZeros().toPlainString()
                + " and " + spec.max().stripTrailingZeros().toPlainString();
    }
}
