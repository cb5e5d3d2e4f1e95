package com.property.reconciliation.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of field declarations describing one import target.
 */
public final class RowSchema {

    private final String name;
    private final Map<String, FieldSpec> fields;

    private RowSchema(String name, Map<String, FieldSpec> fields) {
        this.name = name;
        this.fields = fields;
    }

    public String getName() {
        return name;
    }

    public Collection<FieldSpec> fields() {
        return fields.values();
    }

    public Optional<FieldSpec> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public List<String> requiredFields() {
        List<String> required = new ArrayList<>();
        for (FieldSpec spec : fields.values()) {
            if (spec.required()) {
                required.add(spec.name());
            }
        }
        return required;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public Builder field(FieldSpec spec) {
            if (fields.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate field '" + spec.name() + "' in schema " + name);
            }
            return this;
        }

        public RowSchema build() {
            return new RowSchema(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }

    @Override
    public String toString() {
        return "RowSchema{" + name + ", fields=" + fields.keySet() + '}';
    }
}
